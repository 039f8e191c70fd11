package tech.yump.bootstrap.secretstore;

/**
 * Base exception for failures talking to the secret store.
 * {@code statusCode} is 0 when no HTTP response was received.
 */
public class SecretStoreException extends RuntimeException {

    private final int statusCode;

    public SecretStoreException(String message) {
        this(message, 0);
    }

    public SecretStoreException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SecretStoreException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
