package io.conductor.dispatch;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ProjectPaths {
    private ProjectPaths() {
    }

    /**
     * Absolute, normalized form used as the admission scope. Symlinks are not resolved.
     */
    public static String normalize(String projectPath) {
        if (projectPath == null || projectPath.isBlank()) {
            throw new IllegalArgumentException("project path must not be blank");
        }
        Path normalized = Paths.get(projectPath.trim()).toAbsolutePath().normalize();
        String text = normalized.toString();
        if (text.length() > 1 && (text.endsWith("/") || text.endsWith("\\"))) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }
}
