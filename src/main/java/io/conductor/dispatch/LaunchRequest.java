package io.conductor.dispatch;

import java.util.List;

/**
 * Everything an execution process needs to run one admitted task.
 */
public record LaunchRequest(
        String taskId,
        String projectPath,
        String agentKind,
        String model,
        List<String> additionalDirs,
        String prompt
) {
    public LaunchRequest {
        additionalDirs = additionalDirs == null ? List.of() : List.copyOf(additionalDirs);
    }
}
