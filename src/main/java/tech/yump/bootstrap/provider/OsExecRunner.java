package tech.yump.bootstrap.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ExecRunner} backed by real OS processes ({@link ProcessBuilder}).
 * The child inherits this process's stdout and stderr.
 */
@Slf4j
public class OsExecRunner implements ExecRunner {

    private final String searchPath;

    public OsExecRunner() {
        this(System.getenv("PATH"));
    }

    /**
     * @param searchPath Search path used by {@link #lookPath(String)}, in the platform's PATH format.
     */
    public OsExecRunner(String searchPath) {
        this.searchPath = searchPath != null ? searchPath : "";
    }

    @Override
    public Path lookPath(String name) throws ExecutableNotFoundException {
        if (!StringUtils.hasText(name)) {
            throw new ExecutableNotFoundException("exec: no executable name given");
        }

        try {
            if (name.contains("/") || name.contains(File.separator)) {
                Path candidate = Path.of(name);
                if (isExecutableFile(candidate)) {
                    return candidate.toAbsolutePath().normalize();
                }
                throw new ExecutableNotFoundException("exec: \"" + name + "\": no such executable file");
            }

            for (String dir : searchPath.split(File.pathSeparator)) {
                // An empty entry means the current directory.
                Path candidate = Path.of(dir.isEmpty() ? "." : dir).resolve(name);
                if (isExecutableFile(candidate)) {
                    log.debug("Resolved '{}' to {}", name, candidate.toAbsolutePath());
                    return candidate.toAbsolutePath().normalize();
                }
            }
        } catch (InvalidPathException e) {
            throw new ExecutableNotFoundException("exec: \"" + name + "\": " + e.getMessage());
        }
        throw new ExecutableNotFoundException("exec: \"" + name + "\": executable file not found in $PATH");
    }

    private static boolean isExecutableFile(Path candidate) {
        return Files.isRegularFile(candidate) && Files.isExecutable(candidate);
    }

    @Override
    public ProcessCommand commandContext(CancellationSignal signal, Path executable, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(executable.toString());
        command.addAll(args);
        return new OsProcessCommand(signal, new ProcessBuilder(command).inheritIO());
    }

    private static final class OsProcessCommand implements ProcessCommand {

        private final CancellationSignal signal;
        private final ProcessBuilder processBuilder;
        private final AtomicBoolean killed = new AtomicBoolean(false);
        private Process process;
        private CancellationSignal.Registration registration;

        private OsProcessCommand(CancellationSignal signal, ProcessBuilder processBuilder) {
            this.signal = signal;
            this.processBuilder = processBuilder;
        }

        @Override
        public void start() throws IOException {
            if (process != null) {
                throw new IllegalStateException("process already started");
            }
            if (signal.isCancelled()) {
                throw new IOException("launch cancelled");
            }
            Process started = processBuilder.start();
            process = started;
            registration = signal.onCancel(() -> {
                killed.set(true);
                started.destroyForcibly();
            });
        }

        @Override
        public ProcessOutcome await() {
            if (process == null) {
                return ProcessOutcome.failed(new IllegalStateException("process not started"));
            }
            try {
                int exitCode = process.waitFor();
                if (killed.get()) {
                    return ProcessOutcome.failed(new CancellationException("process killed after cancellation"));
                }
                return ProcessOutcome.exited(exitCode);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                return ProcessOutcome.failed(e);
            } finally {
                if (registration != null) {
                    registration.close();
                }
            }
        }
    }
}
