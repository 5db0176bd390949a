package io.conductor.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.conductor.support.MutableClock;
import io.conductor.support.TempRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class AuditLoggerTest {

    @Test
    void appendsMaskedRowsAndTailsNewestLast() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-audit-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), "orchestrator",
                    MutableClock.startingAt(1_700_000_000_000L));
            audit.log(AuditLogger.AuditEvent.of("task.admit", "tsk_1", "ok", Map.of("project", "/work/app")));
            audit.log(AuditLogger.AuditEvent.of("task.fail", "tsk_1", "failed", Map.of("password", "hunter2")));
            audit.log(AuditLogger.AuditEvent.of("task.admit", "tsk_2", "ok", null));

            List<JsonNode> lastTwo = audit.tail(2);

            Assertions.assertEquals(3, Files.readAllLines(audit.auditFile()).size());
            Assertions.assertEquals(2, lastTwo.size());
            Assertions.assertEquals("task.fail", lastTwo.get(0).path("action").asText());
            Assertions.assertEquals("***", lastTwo.get(0).path("details").path("password").asText());
            Assertions.assertEquals("tsk_2", lastTwo.get(1).path("task_id").asText());
            Assertions.assertEquals("orchestrator", lastTwo.get(1).path("actor").asText());
            Assertions.assertEquals(64, lastTwo.get(1).path("hash").asText().length());
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void tryLogReportsFailedWriteWithoutThrowing() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-audit-unwritable-");
        try {
            Path auditPath = Files.createDirectories(root.resolve("audit.log"));
            AuditLogger audit = new AuditLogger(auditPath, "test", MutableClock.startingAt(0L));
            AuditLogger.AuditEvent event = AuditLogger.AuditEvent.of("task.admit", "tsk_1", "ok", Map.of());

            Assertions.assertThrows(RuntimeException.class, () -> audit.log(event));
            Assertions.assertFalse(audit.tryLog(event));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }

    @Test
    void tailOfMissingFileIsEmpty() throws Exception {
        Path root = Files.createTempDirectory("conductor-test-audit-empty-");
        try {
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"), null, MutableClock.startingAt(0L));
            Assertions.assertEquals(List.of(), audit.tail(10));
        } finally {
            TempRoots.deleteRecursively(root);
        }
    }
}
