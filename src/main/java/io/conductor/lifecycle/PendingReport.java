package io.conductor.lifecycle;

import java.util.List;

/**
 * A lifecycle report that could not be written to the ledger, kept on disk until replayed.
 * {@code reportedAtMs} becomes the task's finish time when the report is applied.
 */
public record PendingReport(
        String taskId,
        Kind kind,
        List<String> filesModified,
        String summary,
        String cliOutput,
        String error,
        long reportedAtMs
) {
    public enum Kind {
        SUCCESS,
        FAILURE
    }

    public PendingReport {
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
    }

    public static PendingReport success(String taskId, List<String> filesModified, String summary, String cliOutput,
                                        long reportedAtMs) {
        return new PendingReport(taskId, Kind.SUCCESS, filesModified, summary, cliOutput, null, reportedAtMs);
    }

    public static PendingReport failure(String taskId, String error, long reportedAtMs) {
        return new PendingReport(taskId, Kind.FAILURE, List.of(), null, null, error, reportedAtMs);
    }
}
