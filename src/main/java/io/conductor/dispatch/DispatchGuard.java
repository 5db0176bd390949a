package io.conductor.dispatch;

import io.conductor.config.DispatchSettings;
import io.conductor.model.TaskRecord;
import io.conductor.observability.AuditLogger;
import io.conductor.storage.TaskLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Admission control: at most one running task per project, no identical request inside the dedup
 * window, and running tasks older than the stale threshold reclaimed on the way in.
 *
 * <p>The running check, reclamation, duplicate check and creation execute in one exclusive ledger
 * transaction, so two processes admitting for the same project are serialized by SQLite.
 */
public final class DispatchGuard {
    public static final String STALE_ERROR = "stale: exceeded maximum task duration";

    private static final Logger log = LoggerFactory.getLogger(DispatchGuard.class);

    private final TaskLedger ledger;
    private final Fingerprinter fingerprinter;
    private final DispatchSettings settings;
    private final Clock clock;
    private final AuditLogger audit;

    public DispatchGuard(TaskLedger ledger, Fingerprinter fingerprinter, DispatchSettings settings, Clock clock,
                         AuditLogger audit) {
        this.ledger = ledger;
        this.fingerprinter = fingerprinter;
        this.settings = settings;
        this.clock = clock;
        this.audit = audit;
    }

    public AdmitDecision admit(String projectPath, String content, String agentKind, String model) {
        String project = ProjectPaths.normalize(projectPath);
        String fingerprint = fingerprinter.fingerprint(project, content);
        long nowMs = clock.millis();

        Admission admission = ledger.inExclusiveTransaction(tx -> {
            TaskRecord reclaimed = null;
            Optional<TaskRecord> running = tx.findRunning(project);
            if (running.isPresent()) {
                TaskRecord existing = running.get();
                if (existing.ageMs(nowMs) <= settings.staleAfterMs()) {
                    return new Admission(AdmitDecision.blocked(
                            AdmitDecision.BlockReason.ALREADY_RUNNING, existing.taskId()), null);
                }
                if (tx.failIfRunningOlderThan(existing.taskId(), nowMs - settings.staleAfterMs(), STALE_ERROR, nowMs)) {
                    reclaimed = existing;
                }
            }

            String reclaimedId = reclaimed == null ? null : reclaimed.taskId();
            Optional<TaskRecord> duplicate = tx.findRecentByFingerprint(
                    fingerprint, nowMs - settings.dedupWindowMs(), reclaimedId);
            if (duplicate.isPresent()) {
                return new Admission(AdmitDecision.blocked(
                        AdmitDecision.BlockReason.DUPLICATE, duplicate.get().taskId()), reclaimed);
            }

            String taskId = "tsk_" + UUID.randomUUID();
            tx.create(TaskRecord.running(taskId, project, agentKind, model, fingerprint, nowMs));
            return new Admission(AdmitDecision.admitted(taskId), reclaimed);
        });

        if (admission.reclaimed() != null) {
            TaskRecord reclaimed = admission.reclaimed();
            log.info("Reclaimed stale task {} for {} after {}ms", reclaimed.taskId(), project, reclaimed.ageMs(nowMs));
            auditEvent("task.reclaim", reclaimed.taskId(), "ok", Map.of(
                    "project", project,
                    "age_ms", reclaimed.ageMs(nowMs)
            ));
        }
        AdmitDecision decision = admission.decision();
        if (decision.isAdmitted()) {
            log.info("Admitted task {} for {} [{}]", decision.taskId(), project, agentKind);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("project", project);
            details.put("agent", agentKind);
            details.put("model", model);
            auditEvent("task.admit", decision.taskId(), "ok", details);
        } else {
            log.info("Blocked dispatch for {}: {} (existing task {})", project, decision.reason(),
                    decision.existingTaskId());
            auditEvent("task.blocked", decision.existingTaskId(), decision.reason().wireName(),
                    Map.of("project", project));
        }
        return decision;
    }

    private record Admission(AdmitDecision decision, TaskRecord reclaimed) {
    }

    private void auditEvent(String action, String taskId, String result, Map<String, Object> details) {
        if (audit != null) {
            audit.tryLog(AuditLogger.AuditEvent.of(action, taskId, result, details));
        }
    }
}
