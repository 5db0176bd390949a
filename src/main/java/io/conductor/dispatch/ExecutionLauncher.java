package io.conductor.dispatch;

import java.io.IOException;

/**
 * Starts an execution process for an admitted task and returns without waiting for it.
 */
public interface ExecutionLauncher {
    /**
     * @return OS process id of the started execution process
     */
    long launch(LaunchRequest request) throws IOException;
}
