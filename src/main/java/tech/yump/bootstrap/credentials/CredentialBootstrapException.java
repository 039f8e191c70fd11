package tech.yump.bootstrap.credentials;

/**
 * Thrown when database credentials cannot be assembled. No partial credential set accompanies it.
 */
public class CredentialBootstrapException extends RuntimeException {
    public CredentialBootstrapException(String message) {
        super(message);
    }

    public CredentialBootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
