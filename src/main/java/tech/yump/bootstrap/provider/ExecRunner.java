package tech.yump.bootstrap.provider;

import java.nio.file.Path;
import java.util.List;

/**
 * Resolves executables and builds child-process commands for the {@link TokenProvider}.
 * Abstracted so launches can be scripted in tests without touching the OS.
 */
public interface ExecRunner {

    /**
     * Resolves {@code name} on the search path. Names containing a path separator are checked as given.
     *
     * @return The absolute path of the executable.
     * @throws ExecutableNotFoundException If no executable file matches.
     */
    Path lookPath(String name) throws ExecutableNotFoundException;

    /**
     * Builds (but does not start) a command running {@code executable} with {@code args}.
     * Cancelling {@code signal} must abort the start or terminate the running process.
     */
    ProcessCommand commandContext(CancellationSignal signal, Path executable, List<String> args);
}
