package io.conductor.dispatch;

import java.util.List;

public record DispatchRequest(
        String projectPath,
        String content,
        String agentKind,
        String model,
        List<String> additionalDirs
) {
    public DispatchRequest {
        additionalDirs = additionalDirs == null ? List.of() : List.copyOf(additionalDirs);
    }
}
