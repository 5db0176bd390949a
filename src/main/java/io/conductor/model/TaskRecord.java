package io.conductor.model;

import java.util.List;

/**
 * One dispatched coding task as persisted in the ledger.
 *
 * <p>{@code finishedAtMs} is {@code null} exactly while {@code status} is {@link TaskStatus#RUNNING}.
 * Terminal records are never rewritten.
 */
public record TaskRecord(
        String taskId,
        String projectPath,
        String agentKind,
        String model,
        TaskStatus status,
        String contentFingerprint,
        long createdAtMs,
        Long finishedAtMs,
        List<String> filesModified,
        String summary,
        String error,
        String cliOutput,
        Long executionPid
) {
    public TaskRecord {
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
    }

    public static TaskRecord running(String taskId, String projectPath, String agentKind, String model,
                                     String contentFingerprint, long createdAtMs) {
        return new TaskRecord(taskId, projectPath, agentKind, model, TaskStatus.RUNNING, contentFingerprint,
                createdAtMs, null, List.of(), null, null, null, null);
    }

    public long ageMs(long nowMs) {
        return Math.max(0L, nowMs - createdAtMs);
    }
}
