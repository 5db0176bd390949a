package io.conductor.agent;

import java.util.List;

/**
 * Command template for one external coding agent.
 *
 * @param command     base argv, without model, extra directories or prompt
 * @param modelFlag   flag preceding the model name, or {@code null} if the backend takes none
 * @param addDirFlag  flag preceding additional readable directories, or {@code null}
 * @param joinAddDirs {@code true} when all directories follow one flag as a comma-separated list
 * @param usesStdin   {@code true} when the prompt is written to stdin, otherwise appended as the last argument
 */
public record AgentBackend(
        String kind,
        String title,
        List<String> command,
        String modelFlag,
        String addDirFlag,
        boolean joinAddDirs,
        boolean usesStdin,
        String defaultModel,
        List<String> models
) {
    public AgentBackend {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("agent backend kind cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("agent backend command cannot be empty: " + kind);
        }
        command = List.copyOf(command);
        models = models == null ? List.of() : List.copyOf(models);
        title = title == null || title.isBlank() ? kind : title;
    }

    public String effectiveModel(String requested) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim();
        }
        return defaultModel;
    }
}
