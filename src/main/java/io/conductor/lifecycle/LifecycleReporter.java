package io.conductor.lifecycle;

import io.conductor.config.DispatchSettings;
import io.conductor.observability.AuditLogger;
import io.conductor.output.Texts;
import io.conductor.security.SensitiveDataMasker;
import io.conductor.storage.LedgerUnavailableException;
import io.conductor.storage.TaskLedger;
import io.conductor.storage.TransitionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes terminal task states. The first terminal write wins; later reports for the same task are
 * no-ops. When the ledger stays unavailable through every retry, the report is persisted to the
 * pending-report queue and applied by {@link #drainPending()}.
 */
public final class LifecycleReporter {
    public static final String ABNORMAL_TERMINATION = "terminated before completion";

    private static final Logger log = LoggerFactory.getLogger(LifecycleReporter.class);

    private final TaskLedger ledger;
    private final PendingReportQueue queue;
    private final DispatchSettings settings;
    private final Clock clock;
    private final AuditLogger audit;

    public LifecycleReporter(TaskLedger ledger, PendingReportQueue queue, DispatchSettings settings, Clock clock,
                             AuditLogger audit) {
        this.ledger = ledger;
        this.queue = queue;
        this.settings = settings;
        this.clock = clock;
        this.audit = audit;
    }

    public ReportOutcome reportSuccess(String taskId, List<String> filesModified, String summary, String cliOutput) {
        PendingReport report = PendingReport.success(
                taskId,
                filesModified,
                Texts.truncate(summary, settings.summaryMaxChars()),
                Texts.tail(SensitiveDataMasker.maskText(cliOutput), settings.cliOutputMaxChars()),
                clock.millis()
        );
        return submit(report);
    }

    public ReportOutcome reportFailure(String taskId, String error) {
        String bounded = Texts.truncate(error == null || error.isBlank() ? "unknown error" : error,
                settings.summaryMaxChars());
        return submit(PendingReport.failure(taskId, SensitiveDataMasker.maskText(bounded), clock.millis()));
    }

    /**
     * Replays queued reports in order. Stops at the first report the ledger still cannot accept.
     */
    public DrainResult drainPending() {
        int recorded = 0;
        int skipped = 0;
        int rejected = 0;
        for (Path file : queue.list()) {
            PendingReport report;
            try {
                report = queue.read(file);
            } catch (IOException e) {
                log.warn("Unreadable pending report {}: {}", file, e.getMessage());
                moveAside(file);
                rejected++;
                continue;
            }
            ReportOutcome outcome;
            try {
                outcome = toOutcome(apply(report), report);
            } catch (LedgerUnavailableException e) {
                log.warn("Ledger still unavailable, {} pending reports remain", queue.size());
                break;
            }
            try {
                queue.remove(file);
            } catch (IOException e) {
                throw new RuntimeException("Failed to remove applied pending report: " + file, e);
            }
            if (outcome == ReportOutcome.RECORDED) {
                recorded++;
            } else {
                skipped++;
            }
            log.info("Replayed pending {} report for task {}: {}", report.kind(), report.taskId(), outcome);
        }
        return new DrainResult(recorded, skipped, rejected, queue.size());
    }

    private ReportOutcome submit(PendingReport report) {
        int attempts = Math.max(1, settings.reportRetryAttempts());
        LedgerUnavailableException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return toOutcome(apply(report), report);
            } catch (LedgerUnavailableException e) {
                last = e;
                log.warn("Ledger unavailable reporting task {} (attempt {}/{}): {}",
                        report.taskId(), attempt, attempts, rootMessage(e));
                if (attempt < attempts && !backoff(attempt)) {
                    break;
                }
            }
        }
        try {
            Path file = queue.enqueue(report);
            log.warn("Queued {} report for task {} at {}", report.kind(), report.taskId(), file);
            auditEvent("report.queued", report.taskId(), report.kind().name().toLowerCase(Locale.ROOT), Map.of());
            return ReportOutcome.QUEUED;
        } catch (IOException e) {
            RuntimeException failure = new RuntimeException("Failed to queue report for task " + report.taskId(), e);
            failure.addSuppressed(last);
            throw failure;
        }
    }

    private TransitionOutcome apply(PendingReport report) {
        if (report.kind() == PendingReport.Kind.SUCCESS) {
            return ledger.complete(report.taskId(), report.filesModified(), report.summary(), report.cliOutput(),
                    report.reportedAtMs());
        }
        return ledger.fail(report.taskId(), report.error(), report.reportedAtMs());
    }

    private ReportOutcome toOutcome(TransitionOutcome transition, PendingReport report) {
        switch (transition) {
            case APPLIED:
                if (report.kind() == PendingReport.Kind.SUCCESS) {
                    log.info("Task {} completed ({} files modified)", report.taskId(), report.filesModified().size());
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("files_modified", report.filesModified().size());
                    details.put("summary", report.summary());
                    auditEvent("task.complete", report.taskId(), "ok", details);
                } else {
                    log.info("Task {} failed: {}", report.taskId(), report.error());
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("error", report.error());
                    auditEvent("task.fail", report.taskId(), "failed", details);
                }
                return ReportOutcome.RECORDED;
            case ALREADY_TERMINAL:
                log.debug("Ignoring {} report for terminal task {}", report.kind(), report.taskId());
                return ReportOutcome.ALREADY_TERMINAL;
            case NOT_FOUND:
                log.warn("Report for unknown task {}", report.taskId());
                return ReportOutcome.NOT_FOUND;
            default:
                throw new IllegalStateException("Unexpected transition outcome " + transition + " for " + report.taskId());
        }
    }

    private boolean backoff(int attempt) {
        long delay = settings.reportRetryBackoffMs() * (1L << Math.min(attempt - 1, 10));
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void moveAside(Path file) {
        try {
            queue.reject(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to move aside pending report: " + file, e);
        }
    }

    private void auditEvent(String action, String taskId, String result, Map<String, Object> details) {
        if (audit != null) {
            audit.tryLog(AuditLogger.AuditEvent.of(action, taskId, result, details));
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable cur = e;
        while (cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur.getMessage();
    }

    public record DrainResult(int recorded, int skipped, int rejected, int remaining) {
    }
}
