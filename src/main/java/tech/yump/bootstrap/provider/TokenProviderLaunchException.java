package tech.yump.bootstrap.provider;

/**
 * Thrown when the token provider process cannot be spawned.
 */
public class TokenProviderLaunchException extends TokenProviderException {
    public TokenProviderLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
