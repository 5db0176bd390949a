package io.conductor.lifecycle;

import io.conductor.model.TaskRecord;
import io.conductor.storage.TaskLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fails running tasks whose execution process has exited without reporting.
 *
 * <p>Tasks without a recorded execution PID are left to time-based stale reclamation.
 */
public final class AbandonmentWatchdog {
    private static final Logger log = LoggerFactory.getLogger(AbandonmentWatchdog.class);

    private final TaskLedger ledger;
    private final LifecycleReporter reporter;
    private final ProcessLivenessProbe probe;

    public AbandonmentWatchdog(TaskLedger ledger, LifecycleReporter reporter, ProcessLivenessProbe probe) {
        this.ledger = ledger;
        this.reporter = reporter;
        this.probe = probe;
    }

    /**
     * @return ids of the tasks this sweep marked failed
     */
    public List<String> sweep() {
        List<String> reaped = new ArrayList<>();
        for (TaskRecord task : ledger.listRunning()) {
            Long pid = task.executionPid();
            if (pid == null || probe.isAlive(pid)) {
                continue;
            }
            ReportOutcome outcome = reporter.reportFailure(task.taskId(), LifecycleReporter.ABNORMAL_TERMINATION);
            log.info("Execution process {} of task {} is gone: {}", pid, task.taskId(), outcome);
            if (outcome == ReportOutcome.RECORDED) {
                reaped.add(task.taskId());
            }
        }
        return reaped;
    }
}
