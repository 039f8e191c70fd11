package tech.yump.bootstrap.provider;

import java.io.IOException;

/**
 * A child process built by an {@link ExecRunner}: started once, then awaited once.
 */
public interface ProcessCommand {

    /**
     * Spawns the process.
     *
     * @throws IOException If the process cannot be spawned (missing shared library, permission denied, cancelled).
     */
    void start() throws IOException;

    /**
     * Blocks until the started process terminates.
     *
     * @return How the process ended.
     */
    ProcessOutcome await();
}
