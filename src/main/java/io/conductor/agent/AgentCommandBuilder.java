package io.conductor.agent;

import java.util.ArrayList;
import java.util.List;

public final class AgentCommandBuilder {
    private AgentCommandBuilder() {
    }

    public static List<String> build(AgentBackend backend, String model, List<String> additionalDirs, String prompt) {
        List<String> argv = new ArrayList<>(backend.command());
        String effectiveModel = backend.effectiveModel(model);
        if (effectiveModel != null && !effectiveModel.isBlank() && backend.modelFlag() != null) {
            argv.add(backend.modelFlag());
            argv.add(effectiveModel);
        }
        if (additionalDirs != null && !additionalDirs.isEmpty() && backend.addDirFlag() != null) {
            if (backend.joinAddDirs()) {
                argv.add(backend.addDirFlag());
                argv.add(String.join(",", additionalDirs));
            } else {
                for (String dir : additionalDirs) {
                    argv.add(backend.addDirFlag());
                    argv.add(dir);
                }
            }
        }
        if (!backend.usesStdin()) {
            argv.add(prompt == null ? "" : prompt);
        }
        return argv;
    }
}
