package tech.yump.bootstrap.provider;

/**
 * Thrown when a launch is attempted before {@link TokenProvider#setConfiguration} succeeded.
 */
public class TokenProviderNotInitializedException extends TokenProviderException {
    public TokenProviderNotInitializedException() {
        super("TokenProvider object not initialized; call SetConfiguration() first");
    }
}
