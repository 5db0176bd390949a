package io.conductor.dispatch;

/**
 * Result of one admission attempt. A blocked decision always names the conflicting task.
 */
public record AdmitDecision(Outcome outcome, BlockReason reason, String taskId, String existingTaskId) {
    public enum Outcome {
        ADMITTED,
        BLOCKED
    }

    public enum BlockReason {
        ALREADY_RUNNING("already_running"),
        DUPLICATE("duplicate");

        private final String wireName;

        BlockReason(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public AdmitDecision {
        if (outcome == Outcome.BLOCKED && (reason == null || existingTaskId == null)) {
            throw new IllegalArgumentException("blocked decision requires reason and existing task id");
        }
    }

    public static AdmitDecision admitted(String taskId) {
        return new AdmitDecision(Outcome.ADMITTED, null, taskId, null);
    }

    public static AdmitDecision blocked(BlockReason reason, String existingTaskId) {
        return new AdmitDecision(Outcome.BLOCKED, reason, null, existingTaskId);
    }

    public boolean isAdmitted() {
        return outcome == Outcome.ADMITTED;
    }
}
