package io.conductor.lifecycle;

/**
 * Answers whether an OS process is still alive.
 */
@FunctionalInterface
public interface ProcessLivenessProbe {
    boolean isAlive(long pid);

    static ProcessLivenessProbe system() {
        return pid -> ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
