package io.conductor.dispatch;

import io.conductor.config.ConductorConfig;
import io.conductor.support.TempRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ProcessExecutionLauncherTest {

    @Test
    void commandRunsTaskInChildJvm() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-launcher-cmd-");
        try {
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            ProcessExecutionLauncher launcher = new ProcessExecutionLauncher(config, "/jdk/bin/java", "app.jar");
            LaunchRequest request = new LaunchRequest("tsk_1", "/work/app", "gemini", "gemini-2.5-pro",
                    List.of("/work/shared"), "prompt");

            List<String> command = launcher.command(request, Path.of("/tmp/p.md"));

            Assertions.assertEquals(List.of(
                    "/jdk/bin/java", "-cp", "app.jar", "io.conductor.Main",
                    "--root", config.rootDir().toString(),
                    "run",
                    "--task-id", "tsk_1",
                    "--project", "/work/app",
                    "--agent", "gemini",
                    "--model", "gemini-2.5-pro",
                    "--add-dir", "/work/shared",
                    "--prompt-file", Path.of("/tmp/p.md").toString()
            ), command);
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void modelFlagIsOmittedWhenBlank() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-launcher-model-");
        try {
            ProcessExecutionLauncher launcher = new ProcessExecutionLauncher(ConductorConfig.fromRoot(root.toString()),
                    "java", "cp");
            List<String> command = launcher.command(
                    new LaunchRequest("tsk_2", "/work/app", "codex", " ", List.of(), "prompt"), Path.of("p.md"));

            Assertions.assertFalse(command.contains("--model"));
            Assertions.assertFalse(command.contains("--add-dir"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void launchWritesPromptFileAndReturnsChildPid() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-launcher-spawn-");
        try {
            Path project = Files.createDirectories(root.resolve("app"));
            ConductorConfig config = ConductorConfig.fromRoot(root.resolve("data").toString());
            ProcessExecutionLauncher launcher = new ProcessExecutionLauncher(config, "true", "unused");

            long pid = launcher.launch(new LaunchRequest("tsk_3", project.toString(), "claude", null, List.of(),
                    "write the tests"));

            Assertions.assertTrue(pid > 0);
            Assertions.assertEquals("write the tests",
                    Files.readString(config.promptsRoot().resolve("tsk_3.md"), StandardCharsets.UTF_8));
            Assertions.assertTrue(Files.exists(config.logsRoot().resolve("tsk_3.log")));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }
}
