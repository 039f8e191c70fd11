package tech.yump.bootstrap.provider;

/**
 * Base exception for token provider failures. Thrown directly for unexpected errors while
 * waiting for the provider process.
 */
public class TokenProviderException extends RuntimeException {
    public TokenProviderException(String message) {
        super(message);
    }

    public TokenProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
