package io.conductor.dispatch;

import io.conductor.util.Hashing;

/**
 * Derives the duplicate-detection key of a dispatch request.
 */
@FunctionalInterface
public interface Fingerprinter {
    String fingerprint(String projectPath, String content);

    /**
     * SHA-256 over the normalized project path and the stripped content, so identical content sent to
     * two different projects is not treated as a duplicate.
     */
    static Fingerprinter projectScoped() {
        return (projectPath, content) -> Hashing.sha256Hex(
                ProjectPaths.normalize(projectPath) + "\n" + (content == null ? "" : content.strip())
        );
    }
}
