package io.conductor.exec;

import io.conductor.agent.AgentBackend;

import java.nio.file.Path;
import java.util.List;

public record ExecutionPlan(
        String taskId,
        Path projectDir,
        AgentBackend backend,
        String model,
        List<String> additionalDirs,
        String prompt
) {
    public ExecutionPlan {
        additionalDirs = additionalDirs == null ? List.of() : List.copyOf(additionalDirs);
    }
}
