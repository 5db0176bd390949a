package io.conductor.exec;

import io.conductor.agent.AgentCommandBuilder;
import io.conductor.lifecycle.LifecycleReporter;
import io.conductor.lifecycle.ReportOutcome;
import io.conductor.observability.MdcContext;
import io.conductor.output.OutputCompactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one agent backend for one task inside the execution process.
 *
 * <p>Agent stdout (merged with stderr) is decoded line by line into the compactor, compact lines are
 * printed, and the outcome is reported exactly once. If the JVM shuts down before that report, a
 * shutdown hook reports the task as abnormally terminated.
 */
public final class ExecutionSession {
    static final int SPAWN_FAILED_EXIT = 127;

    private static final Logger log = LoggerFactory.getLogger(ExecutionSession.class);

    private final ExecutionPlan plan;
    private final LifecycleReporter reporter;
    private final OutputCompactor compactor;
    private final PrintStream out;
    private final AtomicBoolean reported = new AtomicBoolean(false);
    private volatile Process process;

    public ExecutionSession(ExecutionPlan plan, LifecycleReporter reporter, OutputCompactor compactor, PrintStream out) {
        this.plan = plan;
        this.reporter = reporter;
        this.compactor = compactor;
        this.out = out;
    }

    /**
     * @return exit code of the agent process, or {@value #SPAWN_FAILED_EXIT} if it could not be started
     */
    public int run() {
        MdcContext.setTask(plan.taskId(), plan.backend().kind());
        Thread hook = new Thread(this::reportAbandoned, "conductor-shutdown-" + plan.taskId());
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return execute();
        } finally {
            removeHook(hook);
            MdcContext.clear();
        }
    }

    public boolean reported() {
        return reported.get();
    }

    private int execute() {
        List<String> command = AgentCommandBuilder.build(plan.backend(), plan.model(), plan.additionalDirs(),
                plan.prompt());
        log.info("Starting {} in {}", plan.backend().kind(), plan.projectDir());
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(plan.projectDir().toFile());
        pb.redirectErrorStream(true);
        Process started;
        try {
            started = pb.start();
        } catch (IOException e) {
            report(false, "spawn failed: " + e.getMessage());
            return SPAWN_FAILED_EXIT;
        }
        this.process = started;

        writePrompt(started);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(started.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                print(compactor.acceptLine(line));
            }
        } catch (IOException e) {
            started.destroyForcibly();
            print(compactor.finish());
            report(false, "agent output failed: " + e.getMessage());
            return waitQuietly(started);
        }

        int exitCode;
        try {
            exitCode = started.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            started.destroyForcibly();
            report(false, "interrupted while waiting for agent");
            return 1;
        }
        print(compactor.finish());
        String summaryLine = compactor.summaryLine();
        out.println(summaryLine);
        if (exitCode == 0) {
            report(true, summaryLine);
        } else {
            String lastError = compactor.lastError();
            report(false, "exit code " + exitCode + (lastError == null ? "" : ": " + lastError));
        }
        return exitCode;
    }

    private void writePrompt(Process started) {
        try (OutputStream stdin = started.getOutputStream()) {
            if (plan.backend().usesStdin() && plan.prompt() != null) {
                stdin.write(plan.prompt().getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }
        } catch (IOException e) {
            // The agent may exit before reading stdin; its exit code decides the outcome.
            log.warn("Could not write prompt to {}: {}", plan.backend().kind(), e.getMessage());
        }
    }

    private void report(boolean success, String message) {
        if (!reported.compareAndSet(false, true)) {
            return;
        }
        ReportOutcome outcome = success
                ? reporter.reportSuccess(plan.taskId(), compactor.filesModified(), message, compactor.transcript())
                : reporter.reportFailure(plan.taskId(), message);
        log.info("Reported task {} as {}: {}", plan.taskId(), success ? "completed" : "failed", outcome);
    }

    void reportAbandoned() {
        if (!reported.compareAndSet(false, true)) {
            return;
        }
        Process running = process;
        if (running != null && running.isAlive()) {
            running.destroy();
        }
        try {
            ReportOutcome outcome = reporter.reportFailure(plan.taskId(), LifecycleReporter.ABNORMAL_TERMINATION);
            log.warn("Execution of task {} interrupted by shutdown: {}", plan.taskId(), outcome);
        } catch (RuntimeException e) {
            log.error("Failed to report abnormal termination of task {}", plan.taskId(), e);
        }
    }

    private void print(List<String> lines) {
        for (String line : lines) {
            out.println(line);
        }
    }

    private int waitQuietly(Process started) {
        try {
            started.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return started.isAlive() ? 1 : started.exitValue();
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown in progress, keeping shutdown hook");
        }
    }
}
