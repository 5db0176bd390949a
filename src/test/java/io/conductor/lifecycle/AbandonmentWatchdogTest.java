package io.conductor.lifecycle;

import io.conductor.config.ConductorConfig;
import io.conductor.config.DispatchSettings;
import io.conductor.model.TaskStatus;
import io.conductor.storage.TaskLedger;
import io.conductor.support.MutableClock;
import io.conductor.support.TempRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

final class AbandonmentWatchdogTest {

    @Test
    void failsRunningTasksWhoseProcessIsGone() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-watchdog-");
        try {
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            TaskLedger ledger = LifecycleReporterTest.ledger(config);
            LifecycleReporter reporter = new LifecycleReporter(ledger, new PendingReportQueue(config.pendingReportsDir()),
                    DispatchSettings.defaults(), MutableClock.startingAt(1_700_000_100_000L), null);

            String dead = LifecycleReporterTest.running(ledger, "/work/dead");
            String alive = LifecycleReporterTest.running(ledger, "/work/alive");
            String unlaunched = LifecycleReporterTest.running(ledger, "/work/unlaunched");
            ledger.attachExecutionPid(dead, 4001L);
            ledger.attachExecutionPid(alive, 4002L);

            Set<Long> livePids = Set.of(4002L);
            AbandonmentWatchdog watchdog = new AbandonmentWatchdog(ledger, reporter, livePids::contains);

            Assertions.assertEquals(List.of(dead), watchdog.sweep());
            Assertions.assertEquals(TaskStatus.FAILED, ledger.get(dead).orElseThrow().status());
            Assertions.assertEquals(LifecycleReporter.ABNORMAL_TERMINATION, ledger.get(dead).orElseThrow().error());
            Assertions.assertEquals(TaskStatus.RUNNING, ledger.get(alive).orElseThrow().status());
            Assertions.assertEquals(TaskStatus.RUNNING, ledger.get(unlaunched).orElseThrow().status());

            Assertions.assertEquals(List.of(), watchdog.sweep());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }
}
