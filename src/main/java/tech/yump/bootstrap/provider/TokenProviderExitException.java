package tech.yump.bootstrap.provider;

/**
 * Thrown when the token provider process exits with a non-zero code.
 */
public class TokenProviderExitException extends TokenProviderException {

    private final int exitCode;

    public TokenProviderExitException(String executable, int exitCode) {
        super(executable + " terminated with non-zero exit code " + exitCode);
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
