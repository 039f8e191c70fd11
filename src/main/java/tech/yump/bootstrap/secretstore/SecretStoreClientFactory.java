package tech.yump.bootstrap.secretstore;

/**
 * Creates {@link SecretStoreClient}s for a given connection/authentication configuration.
 */
public interface SecretStoreClientFactory {

    /**
     * @throws SecretStoreException If the client cannot be constructed (e.g. unreadable CA certificate).
     */
    SecretStoreClient create(SecretStoreClientConfig config) throws SecretStoreException;
}
