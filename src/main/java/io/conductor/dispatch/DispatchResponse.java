package io.conductor.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DispatchResponse(String status, String taskId, String message) {
    public static final String LAUNCHED = "launched";

    public static DispatchResponse from(AdmitDecision decision) {
        if (decision.isAdmitted()) {
            return new DispatchResponse(LAUNCHED, decision.taskId(), null);
        }
        String message = decision.reason() == AdmitDecision.BlockReason.ALREADY_RUNNING
                ? "A task is already running for this project"
                : "An identical task was dispatched recently";
        return new DispatchResponse(decision.reason().wireName(), decision.existingTaskId(), message);
    }
}
