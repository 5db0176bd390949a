package io.conductor.dispatch;

import io.conductor.config.ConductorConfig;
import io.conductor.config.DispatchSettings;
import io.conductor.lifecycle.LifecycleReporter;
import io.conductor.lifecycle.PendingReportQueue;
import io.conductor.lifecycle.ReportOutcome;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class DispatchGuardTest {
    private static final long START_MS = 1_700_000_000_000L;

    @Test
    void secondDispatchForRunningProjectIsBlocked() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-running-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            Fixture f = new Fixture(root, DispatchSettings.defaults(), clock);

            AdmitDecision first = f.guard.admit("/work/app", "add a login page", "claude", null);
            Assertions.assertTrue(first.isAdmitted());

            clock.advance(Duration.ofMinutes(1));
            AdmitDecision second = f.guard.admit("/work/app", "fix the footer", "claude", null);
            Assertions.assertEquals(AdmitDecision.Outcome.BLOCKED, second.outcome());
            Assertions.assertEquals(AdmitDecision.BlockReason.ALREADY_RUNNING, second.reason());
            Assertions.assertEquals(first.taskId(), second.existingTaskId());
            Assertions.assertEquals(1, f.ledger.listRunning().size());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void differentProjectsAreAdmittedIndependently() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-projects-");
        try {
            Fixture f = new Fixture(root, DispatchSettings.defaults(), MutableClock.startingAt(START_MS));

            Assertions.assertTrue(f.guard.admit("/work/a", "same content", "claude", null).isAdmitted());
            Assertions.assertTrue(f.guard.admit("/work/b", "same content", "claude", null).isAdmitted());
            Assertions.assertEquals(2, f.ledger.listRunning().size());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void identicalContentInsideDedupWindowIsDuplicate() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-duplicate-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            Fixture f = new Fixture(root, DispatchSettings.defaults(), clock);

            AdmitDecision first = f.guard.admit("/work/app", "refactor the parser", "claude", null);
            clock.advance(Duration.ofSeconds(30));
            f.ledger.complete(first.taskId(), List.of("Parser.java"), "done", null, clock.millis());

            clock.advance(Duration.ofMinutes(4));
            AdmitDecision repeat = f.guard.admit("/work/app", "  refactor the parser\n", "claude", null);
            Assertions.assertEquals(AdmitDecision.BlockReason.DUPLICATE, repeat.reason());
            Assertions.assertEquals(first.taskId(), repeat.existingTaskId());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void identicalContentAfterDedupWindowIsAdmitted() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-window-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            Fixture f = new Fixture(root, DispatchSettings.defaults(), clock);

            AdmitDecision first = f.guard.admit("/work/app", "write tests", "claude", null);
            f.ledger.complete(first.taskId(), List.of(), "done", null, clock.millis());

            clock.advance(Duration.ofMinutes(5).plusSeconds(1));
            AdmitDecision again = f.guard.admit("/work/app", "write tests", "claude", null);
            Assertions.assertTrue(again.isAdmitted());
            Assertions.assertNotEquals(first.taskId(), again.taskId());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void staleRunningTaskIsReclaimedAndNewTaskAdmitted() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-stale-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            Fixture f = new Fixture(root, DispatchSettings.defaults(), clock);

            AdmitDecision first = f.guard.admit("/work/app", "long job", "claude", null);
            clock.advance(Duration.ofMinutes(10).plusMillis(1));

            AdmitDecision next = f.guard.admit("/work/app", "another job", "claude", null);
            Assertions.assertTrue(next.isAdmitted());

            TaskRecord reclaimed = f.ledger.get(first.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, reclaimed.status());
            Assertions.assertEquals(DispatchGuard.STALE_ERROR, reclaimed.error());
            Assertions.assertEquals(clock.millis(), reclaimed.finishedAtMs());
            Assertions.assertEquals(next.taskId(), f.ledger.findRunning("/work/app").orElseThrow().taskId());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void runningTaskAtExactlyStaleThresholdStillBlocks() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-threshold-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            Fixture f = new Fixture(root, DispatchSettings.defaults(), clock);

            AdmitDecision first = f.guard.admit("/work/app", "job", "claude", null);
            clock.advance(Duration.ofMinutes(10));

            AdmitDecision next = f.guard.admit("/work/app", "other job", "claude", null);
            Assertions.assertEquals(AdmitDecision.BlockReason.ALREADY_RUNNING, next.reason());
            Assertions.assertEquals(first.taskId(), next.existingTaskId());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void stalenessIsCheckedBeforeDuplicates() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-order-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            DispatchSettings settings = DispatchSettings.defaults()
                    .withStaleAfterMs(Duration.ofMinutes(2).toMillis())
                    .withDedupWindowMs(Duration.ofMinutes(5).toMillis());
            Fixture f = new Fixture(root, settings, clock);

            AdmitDecision first = f.guard.admit("/work/app", "same request", "claude", null);
            clock.advance(Duration.ofMinutes(3));

            AdmitDecision retry = f.guard.admit("/work/app", "same request", "claude", null);
            Assertions.assertTrue(retry.isAdmitted());
            Assertions.assertEquals(TaskStatus.FAILED, f.ledger.get(first.taskId()).orElseThrow().status());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void failedTaskStillCountsAsDuplicateInsideWindow() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-failed-dup-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            Fixture f = new Fixture(root, DispatchSettings.defaults(), clock);

            AdmitDecision first = f.guard.admit("/work/app", "migrate schema", "gemini", "gemini-2.5-pro");
            Assertions.assertTrue(first.isAdmitted());
            Assertions.assertEquals(ReportOutcome.RECORDED, f.reporter.reportFailure(first.taskId(), "agent crashed"));

            clock.advance(Duration.ofSeconds(10));
            AdmitDecision repeat = f.guard.admit("/work/app", "migrate schema", "gemini", "gemini-2.5-pro");
            Assertions.assertEquals(AdmitDecision.BlockReason.DUPLICATE, repeat.reason());
            Assertions.assertEquals(first.taskId(), repeat.existingTaskId());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void concurrentAdmissionsFromSeparateLedgersAdmitExactlyOne() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            new Database(config).init();
            MutableClock clock = MutableClock.startingAt(START_MS);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<AdmitDecision>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String content = "job-" + i;
                futures.add(pool.submit(() -> {
                    // Each worker has its own connections, like a separate orchestrator process.
                    TaskLedger ledger = new TaskLedger(new Database(config));
                    DispatchGuard guard = new DispatchGuard(ledger, Fingerprinter.projectScoped(),
                            DispatchSettings.defaults(), clock, null);
                    start.await();
                    return guard.admit("/work/shared", content, "claude", null);
                }));
            }
            start.countDown();

            int admitted = 0;
            List<String> existing = new ArrayList<>();
            for (Future<AdmitDecision> future : futures) {
                AdmitDecision decision = future.get(30, TimeUnit.SECONDS);
                if (decision.isAdmitted()) {
                    admitted++;
                } else {
                    Assertions.assertEquals(AdmitDecision.BlockReason.ALREADY_RUNNING, decision.reason());
                    existing.add(decision.existingTaskId());
                }
            }
            Assertions.assertEquals(1, admitted);
            TaskLedger ledger = new TaskLedger(new Database(config));
            String runningId = ledger.findRunning("/work/shared").orElseThrow().taskId();
            Assertions.assertTrue(existing.stream().allMatch(runningId::equals));
            Assertions.assertEquals(1, ledger.listRunning().size());
        } finally {
            pool.shutdownNow();
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void admissionsAreAudited() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-audit-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            Fixture f = new Fixture(root, DispatchSettings.defaults(), clock);

            AdmitDecision first = f.guard.admit("/work/app", "job", "claude", null);
            f.guard.admit("/work/app", "job 2", "claude", null);

            List<String> actions = f.audit.tail(10).stream().map(row -> row.path("action").asText()).toList();
            Assertions.assertEquals(List.of("task.admit", "task.blocked"), actions);
            Assertions.assertEquals(first.taskId(), f.audit.tail(1).get(0).path("task_id").asText());
            Assertions.assertEquals("already_running", f.audit.tail(1).get(0).path("result").asText());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void unwritableAuditLogDoesNotUndoAdmission() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-guard-audit-");
        try {
            MutableClock clock = MutableClock.startingAt(START_MS);
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            TaskLedger ledger = new TaskLedger(db);
            Path auditPath = Files.createDirectories(root.resolve("audit-as-directory"));
            DispatchGuard guard = new DispatchGuard(ledger, Fingerprinter.projectScoped(), DispatchSettings.defaults(),
                    clock, new AuditLogger(auditPath, "test", clock));

            AdmitDecision first = guard.admit("/work/app", "job", "claude", null);
            AdmitDecision second = guard.admit("/work/app", "other job", "claude", null);

            Assertions.assertTrue(first.isAdmitted());
            Assertions.assertEquals(AdmitDecision.BlockReason.ALREADY_RUNNING, second.reason());
            Assertions.assertEquals(TaskStatus.RUNNING, ledger.get(first.taskId()).orElseThrow().status());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    private static final class Fixture {
        final TaskLedger ledger;
        final AuditLogger audit;
        final DispatchGuard guard;
        final LifecycleReporter reporter;

        Fixture(Path root, DispatchSettings settings, MutableClock clock) {
            ConductorConfig config = ConductorConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            this.ledger = new TaskLedger(db);
            this.audit = new AuditLogger(config.auditFile(), "test", clock);
            this.guard = new DispatchGuard(ledger, Fingerprinter.projectScoped(), settings, clock, audit);
            this.reporter = new LifecycleReporter(ledger, new PendingReportQueue(config.pendingReportsDir()),
                    settings, clock, audit);
        }
    }
}
