package tech.yump.bootstrap.provider;

/**
 * How an awaited process ended: it exited with a code, or waiting for it failed.
 */
public record ProcessOutcome(
        Status status,
        int exitCode,
        Throwable error
) {

    public enum Status {
        EXITED,
        FAILED
    }

    public static ProcessOutcome exited(int exitCode) {
        return new ProcessOutcome(Status.EXITED, exitCode, null);
    }

    public static ProcessOutcome failed(Throwable error) {
        return new ProcessOutcome(Status.FAILED, -1, error);
    }

    public boolean isSuccess() {
        return status == Status.EXITED && exitCode == 0;
    }
}
