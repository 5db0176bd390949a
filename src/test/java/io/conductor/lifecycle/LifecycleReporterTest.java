package io.conductor.lifecycle;

import io.conductor.config.ConductorConfig;
import io.conductor.config.DispatchSettings;
import io.conductor.model.TaskRecord;
import io.conductor.model.TaskStatus;
import io.conductor.observability.AuditLogger;
import io.conductor.storage.Database;
import io.conductor.storage.TaskLedger;
import io.conductor.support.MutableClock;
import io.conductor.support.TempRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

final class LifecycleReporterTest {
    private static final long START_MS = 1_700_000_000_000L;

    @Test
    void successIsRecordedAndLaterFailureIsIgnored() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-reporter-success-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            TaskLedger ledger = ledger(config);
            LifecycleReporter reporter = new LifecycleReporter(ledger, new PendingReportQueue(config.pendingReportsDir()),
                    DispatchSettings.defaults(), clock, null);
            String taskId = running(ledger, "/work/app");

            clock.advance(Duration.ofMinutes(3));
            ReportOutcome first = reporter.reportSuccess(taskId, List.of("src/App.java"), "Added login", "[RESULT] ok");
            ReportOutcome second = reporter.reportFailure(taskId, "exit code 1");

            Assertions.assertEquals(ReportOutcome.RECORDED, first);
            Assertions.assertEquals(ReportOutcome.ALREADY_TERMINAL, second);
            TaskRecord record = ledger.get(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, record.status());
            Assertions.assertEquals(List.of("src/App.java"), record.filesModified());
            Assertions.assertEquals("Added login", record.summary());
            Assertions.assertEquals(START_MS + Duration.ofMinutes(3).toMillis(), record.finishedAtMs());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void failureIsBoundedAndMasked() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-reporter-failure-");
        try {
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            TaskLedger ledger = ledger(config);
            LifecycleReporter reporter = new LifecycleReporter(ledger, new PendingReportQueue(config.pendingReportsDir()),
                    DispatchSettings.defaults(), MutableClock.startingAt(START_MS), null);
            String taskId = running(ledger, "/work/app");

            String error = "API_TOKEN=abc123 rejected " + "x".repeat(2_000);
            Assertions.assertEquals(ReportOutcome.RECORDED, reporter.reportFailure(taskId, error));

            TaskRecord record = ledger.get(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, record.status());
            Assertions.assertFalse(record.error().contains("abc123"));
            Assertions.assertTrue(record.error().length() <= DispatchSettings.defaults().summaryMaxChars());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void unwritableAuditLogDoesNotFailCommittedReport() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-reporter-audit-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            TaskLedger ledger = ledger(config);
            Path auditPath = Files.createDirectories(root.resolve("audit-as-directory"));
            LifecycleReporter reporter = new LifecycleReporter(ledger, new PendingReportQueue(config.pendingReportsDir()),
                    DispatchSettings.defaults(), clock, new AuditLogger(auditPath, "test", clock));
            String taskId = running(ledger, "/work/app");

            Assertions.assertEquals(ReportOutcome.RECORDED,
                    reporter.reportSuccess(taskId, List.of("a.py"), "done", "ok"));
            Assertions.assertEquals(TaskStatus.COMPLETED, ledger.get(taskId).orElseThrow().status());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void reportForUnknownTaskIsNotFound() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-reporter-unknown-");
        try {
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            LifecycleReporter reporter = new LifecycleReporter(ledger(config),
                    new PendingReportQueue(config.pendingReportsDir()), DispatchSettings.defaults(),
                    MutableClock.startingAt(START_MS), null);

            Assertions.assertEquals(ReportOutcome.NOT_FOUND, reporter.reportFailure("tsk_missing", "boom"));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void reportIsQueuedWhileLedgerIsUnavailableAndDrainedLater() throws Exception {
        Path goodRoot = Files.createTempDirectory("conductor-test-reporter-good-");
        Path brokenRoot = Files.createTempDirectory("conductor-test-reporter-broken-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            DispatchSettings settings = DispatchSettings.defaults().withReportRetry(2, 0L);
            ConductorConfig goodConfig = ConductorConfig.fromRoot(goodRoot.toString());
            TaskLedger goodLedger = ledger(goodConfig);
            String taskId = running(goodLedger, "/work/app");

            ConductorConfig brokenConfig = ConductorConfig.fromRoot(brokenRoot.toString());
            Files.createDirectories(brokenConfig.dbFile());
            TaskLedger brokenLedger = new TaskLedger(new Database(brokenConfig, 100));
            PendingReportQueue queue = new PendingReportQueue(goodConfig.pendingReportsDir());

            clock.advance(Duration.ofMinutes(2));
            LifecycleReporter offline = new LifecycleReporter(brokenLedger, queue, settings, clock, null);
            Assertions.assertEquals(ReportOutcome.QUEUED,
                    offline.reportSuccess(taskId, List.of("a.py"), "done", "output"));
            Assertions.assertEquals(1, queue.size());
            Assertions.assertEquals(TaskStatus.RUNNING, goodLedger.get(taskId).orElseThrow().status());

            clock.advance(Duration.ofMinutes(5));
            LifecycleReporter online = new LifecycleReporter(goodLedger, queue, settings, clock, null);
            LifecycleReporter.DrainResult drained = online.drainPending();

            Assertions.assertEquals(new LifecycleReporter.DrainResult(1, 0, 0, 0), drained);
            TaskRecord record = goodLedger.get(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, record.status());
            Assertions.assertEquals(START_MS + Duration.ofMinutes(2).toMillis(), record.finishedAtMs());
        } finally {
            TempRoots.deleteRecursively(goodRoot);
            TempRoots.deleteRecursively(brokenRoot);
        }
    }

    @Test
    void unreadablePendingReportIsMovedAside() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-reporter-reject-");
        try {
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            TaskLedger ledger = ledger(config);
            PendingReportQueue queue = new PendingReportQueue(config.pendingReportsDir());
            Files.writeString(config.pendingReportsDir().resolve("0000000000001-tsk_x-deadbeef.json"), "{broken");
            LifecycleReporter reporter = new LifecycleReporter(ledger, queue, DispatchSettings.defaults(),
                    MutableClock.startingAt(START_MS), null);

            LifecycleReporter.DrainResult drained = reporter.drainPending();

            Assertions.assertEquals(1, drained.rejected());
            Assertions.assertEquals(0, drained.remaining());
            Assertions.assertTrue(Files.exists(config.reportsRoot().resolve("rejected")
                    .resolve("0000000000001-tsk_x-deadbeef.json")));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    static TaskLedger ledger(ConductorConfig config) {
        Database db = new Database(config);
        db.init();
        return new TaskLedger(db);
    }

    static String running(TaskLedger ledger, String project) {
        String taskId = "tsk_" + UUID.randomUUID();
        ledger.create(TaskRecord.running(taskId, project, "claude", null, "fp-" + taskId, START_MS));
        return taskId;
    }
}
