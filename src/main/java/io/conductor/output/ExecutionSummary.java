package io.conductor.output;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/**
 * Counters gathered while an agent ran.
 */
public record ExecutionSummary(
        long durationMs,
        List<String> filesRead,
        List<String> filesModified,
        int toolCalls,
        Map<ToolKind, Integer> toolCallsByKind,
        int errors,
        String lastError
) {
    private static final int LISTED_FILES = 5;

    public ExecutionSummary {
        filesRead = List.copyOf(filesRead);
        filesModified = List.copyOf(filesModified);
        toolCallsByKind = Map.copyOf(toolCallsByKind);
    }

    public String toSummaryLine(int maxChars) {
        StringBuilder line = new StringBuilder()
                .append("Duration: ").append(durationMs / 1000L).append('s')
                .append(", Files read: ").append(filesRead.size())
                .append(", Files modified: ").append(filesModified.size());
        if (!filesModified.isEmpty()) {
            line.append(" (");
            for (int i = 0; i < Math.min(LISTED_FILES, filesModified.size()); i++) {
                if (i > 0) {
                    line.append(", ");
                }
                line.append(fileName(filesModified.get(i)));
            }
            if (filesModified.size() > LISTED_FILES) {
                line.append(", +").append(filesModified.size() - LISTED_FILES).append(" more");
            }
            line.append(')');
        }
        line.append(", Tool calls: ").append(toolCalls)
                .append(", Errors: ").append(errors);
        return Texts.truncate(line.toString(), maxChars);
    }

    private static String fileName(String path) {
        try {
            Path name = Paths.get(path).getFileName();
            return name == null ? path : name.toString();
        } catch (RuntimeException e) {
            return path;
        }
    }
}
