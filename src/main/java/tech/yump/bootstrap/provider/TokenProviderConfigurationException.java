package tech.yump.bootstrap.provider;

/**
 * Thrown when the token provider configuration is unusable: unsupported provider type, or
 * an executable that cannot be found.
 */
public class TokenProviderConfigurationException extends TokenProviderException {
    public TokenProviderConfigurationException(String message) {
        super(message);
    }

    public TokenProviderConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
