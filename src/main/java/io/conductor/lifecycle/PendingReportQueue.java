package io.conductor.lifecycle;

import io.conductor.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Directory of pending reports, one JSON file each. Files are written to a temporary name and moved
 * into place, so a reader never sees a partial report.
 */
public final class PendingReportQueue {
    private static final Logger log = LoggerFactory.getLogger(PendingReportQueue.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Path rejectedDirectory;

    public PendingReportQueue(Path directory) {
        this.directory = directory;
        this.rejectedDirectory = directory.resolveSibling("rejected");
    }

    public Path directory() {
        return directory;
    }

    public Path enqueue(PendingReport report) throws IOException {
        Files.createDirectories(directory);
        String name = String.format("%013d-%s-%s", report.reportedAtMs(), report.taskId(),
                UUID.randomUUID().toString().substring(0, 8));
        Path tmp = directory.resolve("." + name + ".tmp");
        Path target = directory.resolve(name + SUFFIX);
        Files.writeString(tmp, Jsons.toJson(report), StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        return target;
    }

    /**
     * Queued report files, oldest first.
     */
    public List<Path> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to list pending reports: " + directory, e);
        }
    }

    public PendingReport read(Path file) throws IOException {
        return Jsons.mapper().readValue(file.toFile(), PendingReport.class);
    }

    public void remove(Path file) throws IOException {
        Files.deleteIfExists(file);
    }

    /**
     * Moves an unreadable report aside so it no longer blocks draining.
     */
    public Path reject(Path file) throws IOException {
        Files.createDirectories(rejectedDirectory);
        Path target = rejectedDirectory.resolve(file.getFileName());
        Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        log.warn("Rejected unreadable pending report {}", target);
        return target;
    }

    public int size() {
        return list().size();
    }
}
