package io.conductor.agent;

import io.conductor.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class AgentBackendRegistry {
    private static final Logger log = LoggerFactory.getLogger(AgentBackendRegistry.class);

    private final Map<String, AgentBackend> backends = new ConcurrentHashMap<>();

    public static AgentBackendRegistry withDefaults() {
        AgentBackendRegistry registry = new AgentBackendRegistry();
        registry.register(new AgentBackend(
                "claude",
                "Claude Code",
                List.of("claude", "-p", "--permission-mode", "bypassPermissions", "--output-format", "stream-json",
                        "--include-partial-messages", "--verbose", "--max-turns", "50"),
                "--model",
                "--add-dir",
                false,
                true,
                "sonnet",
                List.of("opus", "sonnet")
        ));
        registry.register(new AgentBackend(
                "gemini",
                "Gemini CLI",
                List.of("gemini", "--output-format", "stream-json", "--approval-mode", "yolo"),
                "-m",
                "--include-directories",
                true,
                true,
                "gemini-2.5-pro",
                List.of("gemini-2.5-flash", "gemini-2.5-pro")
        ));
        registry.register(new AgentBackend(
                "codex",
                "OpenAI Codex",
                List.of("codex", "exec", "--json", "--full-auto"),
                "--model",
                null,
                false,
                false,
                "gpt-5-codex",
                List.of("gpt-5-codex")
        ));
        return registry;
    }

    public void register(AgentBackend backend) {
        backends.put(backend.kind(), backend);
    }

    public Optional<AgentBackend> findByKind(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(backends.get(kind.trim()));
    }

    public Collection<AgentBackend> list() {
        return backends.values().stream()
                .sorted((a, b) -> a.kind().compareTo(b.kind()))
                .toList();
    }

    /**
     * Registers backends declared in {@code agents.json}; entries replace defaults of the same kind.
     *
     * @return number of backends loaded
     */
    public int loadOverrides(Path agentsFile) {
        if (agentsFile == null || !Files.exists(agentsFile)) {
            return 0;
        }
        try {
            AgentBackendFile file = Jsons.mapper().readValue(agentsFile.toFile(), AgentBackendFile.class);
            if (file == null || file.agents() == null || file.agents().isEmpty()) {
                return 0;
            }
            int loaded = 0;
            int skipped = 0;
            for (AgentBackendSpec spec : file.agents()) {
                if (spec == null) {
                    skipped++;
                    continue;
                }
                try {
                    register(spec.toBackend());
                    loaded++;
                } catch (IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipping invalid agent backend in {}: {}", agentsFile, e.getMessage());
                }
            }
            log.info("Loaded {} agent backend(s) from {} (skipped {})", loaded, agentsFile, skipped);
            return loaded;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load agent backend config: " + agentsFile, e);
        }
    }

    record AgentBackendFile(List<AgentBackendSpec> agents) {
    }

    record AgentBackendSpec(
            String kind,
            String title,
            List<String> command,
            String modelFlag,
            String addDirFlag,
            Boolean joinAddDirs,
            Boolean usesStdin,
            String defaultModel,
            List<String> models
    ) {
        AgentBackend toBackend() {
            return new AgentBackend(
                    kind,
                    title,
                    command,
                    modelFlag,
                    addDirFlag,
                    Boolean.TRUE.equals(joinAddDirs),
                    usesStdin == null || usesStdin,
                    defaultModel,
                    models
            );
        }
    }
}
