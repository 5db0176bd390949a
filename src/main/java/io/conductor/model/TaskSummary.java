package io.conductor.model;

public record TaskSummary(
        String taskId,
        TaskStatus status,
        String agentKind,
        String projectPath,
        long createdAtMs,
        Long finishedAtMs
) {
    public static TaskSummary of(TaskRecord record) {
        return new TaskSummary(
                record.taskId(),
                record.status(),
                record.agentKind(),
                record.projectPath(),
                record.createdAtMs(),
                record.finishedAtMs()
        );
    }
}
