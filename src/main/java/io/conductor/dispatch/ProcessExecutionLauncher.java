package io.conductor.dispatch;

import io.conductor.config.ConductorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Spawns {@code io.conductor.Main run} in a new JVM with stdout and stderr appended to
 * {@code <root>/logs/<taskId>.log}. The child is not awaited and outlives the caller.
 */
public final class ProcessExecutionLauncher implements ExecutionLauncher {
    private static final Logger log = LoggerFactory.getLogger(ProcessExecutionLauncher.class);
    private static final String MAIN_CLASS = "io.conductor.Main";

    private final ConductorConfig config;
    private final String javaExecutable;
    private final String classpath;

    public ProcessExecutionLauncher(ConductorConfig config) {
        this(config, defaultJavaExecutable(), System.getProperty("java.class.path"));
    }

    public ProcessExecutionLauncher(ConductorConfig config, String javaExecutable, String classpath) {
        this.config = config;
        this.javaExecutable = javaExecutable;
        this.classpath = classpath;
    }

    @Override
    public long launch(LaunchRequest request) throws IOException {
        Files.createDirectories(config.promptsRoot());
        Files.createDirectories(config.logsRoot());
        Path promptFile = config.promptsRoot().resolve(request.taskId() + ".md");
        Files.writeString(promptFile, request.prompt(), StandardCharsets.UTF_8);
        Path logFile = config.logsRoot().resolve(request.taskId() + ".log");

        ProcessBuilder pb = new ProcessBuilder(command(request, promptFile));
        pb.directory(Paths.get(request.projectPath()).toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        Process process = pb.start();
        log.info("Launched execution process {} for task {} (log: {})", process.pid(), request.taskId(), logFile);
        return process.pid();
    }

    List<String> command(LaunchRequest request, Path promptFile) {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaExecutable);
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(MAIN_CLASS);
        cmd.add("--root");
        cmd.add(config.rootDir().toString());
        cmd.add("run");
        cmd.add("--task-id");
        cmd.add(request.taskId());
        cmd.add("--project");
        cmd.add(request.projectPath());
        cmd.add("--agent");
        cmd.add(request.agentKind());
        if (request.model() != null && !request.model().isBlank()) {
            cmd.add("--model");
            cmd.add(request.model());
        }
        for (String dir : request.additionalDirs()) {
            cmd.add("--add-dir");
            cmd.add(dir);
        }
        cmd.add("--prompt-file");
        cmd.add(promptFile.toString());
        return cmd;
    }

    private static String defaultJavaExecutable() {
        return Paths.get(System.getProperty("java.home"), "bin", "java").toString();
    }

    private static File nullDevice() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return new File(os.contains("win") ? "NUL" : "/dev/null");
    }
}
