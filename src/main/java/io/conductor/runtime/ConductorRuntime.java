package io.conductor.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.conductor.agent.AgentBackend;
import io.conductor.agent.AgentBackendRegistry;
import io.conductor.config.ConductorConfig;
import io.conductor.config.DispatchSettings;
import io.conductor.dispatch.AdmitDecision;
import io.conductor.dispatch.DispatchGuard;
import io.conductor.dispatch.DispatchRequest;
import io.conductor.dispatch.DispatchResponse;
import io.conductor.dispatch.ExecutionLauncher;
import io.conductor.dispatch.Fingerprinter;
import io.conductor.dispatch.LaunchRequest;
import io.conductor.dispatch.ProcessExecutionLauncher;
import io.conductor.dispatch.ProjectPaths;
import io.conductor.dispatch.PromptComposer;
import io.conductor.exec.ExecutionPlan;
import io.conductor.exec.ExecutionSession;
import io.conductor.lifecycle.AbandonmentWatchdog;
import io.conductor.lifecycle.LifecycleReporter;
import io.conductor.lifecycle.PendingReportQueue;
import io.conductor.lifecycle.ProcessLivenessProbe;
import io.conductor.lifecycle.ReportOutcome;
import io.conductor.model.TaskRecord;
import io.conductor.model.TaskSummary;
import io.conductor.observability.AuditLogger;
import io.conductor.output.AgentStreamDecoder;
import io.conductor.output.OutputCompactor;
import io.conductor.storage.Database;
import io.conductor.storage.TaskLedger;
import io.conductor.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ConductorRuntime {
    private static final Logger log = LoggerFactory.getLogger(ConductorRuntime.class);

    private final ConductorConfig config;
    private final DispatchSettings settings;
    private final Clock clock;
    private final Database database;
    private final TaskLedger ledger;
    private final AgentBackendRegistry agentRegistry;
    private final AuditLogger auditLogger;
    private final DispatchGuard guard;
    private final LifecycleReporter reporter;
    private final AbandonmentWatchdog watchdog;
    private final ExecutionLauncher launcher;
    private final PromptComposer promptComposer;

    public ConductorRuntime(ConductorConfig config) {
        this(config, DispatchSettings.load(config.settingsFile()), Clock.systemUTC(),
                new ProcessExecutionLauncher(config), ProcessLivenessProbe.system());
    }

    public ConductorRuntime(ConductorConfig config, DispatchSettings settings, Clock clock,
                            ExecutionLauncher launcher, ProcessLivenessProbe probe) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.ledger = new TaskLedger(database);
        this.agentRegistry = AgentBackendRegistry.withDefaults();
        this.auditLogger = new AuditLogger(config.auditFile(), "conductor", clock);
        this.guard = new DispatchGuard(ledger, Fingerprinter.projectScoped(), settings, clock, auditLogger);
        this.reporter = new LifecycleReporter(ledger, new PendingReportQueue(config.pendingReportsDir()), settings,
                clock, auditLogger);
        this.watchdog = new AbandonmentWatchdog(ledger, reporter, probe);
        this.launcher = launcher;
        this.promptComposer = new PromptComposer(settings.systemPrompt());
    }

    public void init() {
        database.init();
        agentRegistry.loadOverrides(config.agentsFile());
    }

    /**
     * Initializes the data root and replays any reports queued while the ledger was unavailable.
     */
    public InitOutcome initAndDrain() {
        init();
        LifecycleReporter.DrainResult drained = reporter.drainPending();
        return new InitOutcome(config.rootDir().toString(), agentRegistry.list().size(), drained);
    }

    public DispatchResponse dispatch(DispatchRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("dispatch request is required");
        }
        if (request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        String project = ProjectPaths.normalize(request.projectPath());
        if (!Files.isDirectory(Paths.get(project))) {
            throw new IllegalArgumentException("project path is not a directory: " + project);
        }
        AgentBackend backend = agentRegistry.findByKind(request.agentKind())
                .orElseThrow(() -> new IllegalArgumentException("unknown agent kind: " + request.agentKind()));
        String model = backend.effectiveModel(request.model());
        List<String> additionalDirs = new ArrayList<>();
        for (String dir : request.additionalDirs()) {
            additionalDirs.add(ProjectPaths.normalize(dir));
        }

        List<String> reaped = watchdog.sweep();
        if (!reaped.isEmpty()) {
            log.info("Reaped {} abandoned task(s) before dispatch", reaped.size());
        }

        AdmitDecision decision = guard.admit(project, request.content(), backend.kind(), model);
        if (!decision.isAdmitted()) {
            return DispatchResponse.from(decision);
        }

        String taskId = decision.taskId();
        LaunchRequest launch = new LaunchRequest(taskId, project, backend.kind(), model, additionalDirs,
                promptComposer.compose(request.content()));
        long pid;
        try {
            pid = launcher.launch(launch);
        } catch (IOException | RuntimeException e) {
            reporter.reportFailure(taskId, "launch failed: " + e.getMessage());
            throw new IllegalStateException("Failed to launch execution for task " + taskId, e);
        }
        ledger.attachExecutionPid(taskId, pid);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pid", pid);
        details.put("agent", backend.kind());
        details.put("model", model);
        auditLogger.tryLog(AuditLogger.AuditEvent.of("task.launch", taskId, "ok", details));
        return DispatchResponse.from(decision);
    }

    /**
     * Body of the detached execution process: runs the agent and reports the outcome.
     *
     * @return agent exit code, used as the process exit code
     */
    public int runTask(RunRequest request, PrintStream out) {
        Optional<AgentBackend> backend = agentRegistry.findByKind(request.agentKind());
        if (backend.isEmpty()) {
            reporter.reportFailure(request.taskId(), "unknown agent kind: " + request.agentKind());
            return 2;
        }
        String prompt;
        try {
            prompt = Files.readString(request.promptFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            reporter.reportFailure(request.taskId(), "prompt unreadable: " + e.getMessage());
            return 2;
        }
        ExecutionPlan plan = new ExecutionPlan(request.taskId(), request.projectDir(), backend.get(), request.model(),
                request.additionalDirs(), prompt);
        OutputCompactor compactor = new OutputCompactor(new AgentStreamDecoder(), clock,
                settings.cliOutputMaxChars(), settings.summaryMaxChars());
        return new ExecutionSession(plan, reporter, compactor, out).run();
    }

    public Optional<TaskRecord> getTask(String taskId) {
        return ledger.get(taskId);
    }

    public List<TaskSummary> listRecent(int limit) {
        return ledger.listRecentSummaries(limit);
    }

    public ReportOutcome reportSuccess(String taskId, List<String> filesModified, String summary, String cliOutput) {
        return reporter.reportSuccess(taskId, filesModified, summary, cliOutput);
    }

    public ReportOutcome reportFailure(String taskId, String error) {
        return reporter.reportFailure(taskId, error);
    }

    public List<String> reap() {
        return watchdog.sweep();
    }

    public LifecycleReporter.DrainResult drainPendingReports() {
        return reporter.drainPending();
    }

    public TaskExportOutcome exportTask(String taskId, String outputPath) {
        Optional<TaskRecord> task = ledger.get(taskId);
        if (task.isEmpty()) {
            return new TaskExportOutcome(taskId, false, 0, "task not found");
        }
        Path out = outputPath == null || outputPath.isBlank()
                ? config.exportsRoot().resolve(taskId + ".json")
                : Paths.get(outputPath).toAbsolutePath().normalize();
        List<JsonNode> auditRows = auditLogger.tail(Integer.MAX_VALUE).stream()
                .filter(row -> taskId.equals(row.path("task_id").asText(null)))
                .toList();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task", task.get());
        payload.put("audit_events", auditRows);
        payload.put("exported_at", clock.instant().toString());
        try {
            if (out.getParent() != null) {
                Files.createDirectories(out.getParent());
            }
            Files.writeString(out, Jsons.toJson(payload), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to export task: " + taskId, e);
        }
        return new TaskExportOutcome(taskId, true, auditRows.size(), out.toString());
    }

    public List<JsonNode> auditTail(int lines) {
        return auditLogger.tail(lines);
    }

    public Collection<AgentBackend> agents() {
        return agentRegistry.list();
    }

    public DispatchSettings settings() {
        return settings;
    }

    public ConductorConfig config() {
        return config;
    }

    public record RunRequest(
            String taskId,
            Path projectDir,
            String agentKind,
            String model,
            List<String> additionalDirs,
            Path promptFile
    ) {
        public RunRequest {
            additionalDirs = additionalDirs == null ? List.of() : List.copyOf(additionalDirs);
        }
    }

    public record InitOutcome(String root, int agents, LifecycleReporter.DrainResult pendingReports) {
    }

    public record TaskExportOutcome(String taskId, boolean exported, int auditRows, String output) {
    }
}
