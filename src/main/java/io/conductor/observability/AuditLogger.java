package io.conductor.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.conductor.security.SensitiveDataMasker;
import io.conductor.util.Hashing;
import io.conductor.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail shared by the orchestrator and execution processes.
 *
 * <p>Each row is written with a single append and carries the SHA-256 of its own content.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String actor;
    private final Clock clock;

    public AuditLogger(Path auditFile, String actor, Clock clock) {
        this.auditFile = auditFile;
        this.actor = actor == null || actor.isBlank() ? "conductor" : actor.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", actor);
        row.put("task_id", event.taskId());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("hash", Hashing.sha256Hex(Jsons.toCompactJson(row)));
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    /**
     * Like {@link #log(AuditEvent)}, but a failed write is logged instead of thrown. Used for
     * events recorded after the ledger change they describe has already been committed.
     *
     * @return {@code true} if the row was written
     */
    public boolean tryLog(AuditEvent event) {
        try {
            log(event);
            return true;
        } catch (RuntimeException e) {
            log.warn("Audit event {} for task {} not recorded: {}", event.action(), event.taskId(),
                    e.getCause() == null ? e.getMessage() : e.getCause().toString());
            return false;
        }
    }

    /**
     * Returns the last {@code limit} rows, oldest first.
     */
    public List<JsonNode> tail(int limit) {
        int bounded = Math.max(1, limit);
        List<String> lines;
        try {
            lines = Files.exists(auditFile) ? Files.readAllLines(auditFile, StandardCharsets.UTF_8) : List.of();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        List<JsonNode> out = new ArrayList<>();
        for (int i = Math.max(0, lines.size() - bounded); i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                out.add(Jsons.mapper().readTree(line));
            } catch (IOException e) {
                throw new RuntimeException("Corrupt audit row at line " + (i + 1), e);
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record AuditEvent(String action, String taskId, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String taskId, String result, Map<String, Object> details) {
            return new AuditEvent(action, taskId, result, details == null ? Map.of() : details);
        }
    }
}
