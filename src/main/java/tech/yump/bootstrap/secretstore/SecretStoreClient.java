package tech.yump.bootstrap.secretstore;

import java.util.Map;

/**
 * Read access to a Vault/OpenBao compatible secret store.
 */
public interface SecretStoreClient {

    /**
     * Reads the secret stored at {@code subPath}, relative to the client's base path.
     *
     * @param subPath Sub-path of the secret, starting with '/' (e.g. "/redisdb").
     * @param keys    Keys to return. When empty, every key stored at the path is returned.
     * @return The requested key/value pairs.
     * @throws SecretNotFoundException If the path does not exist or a requested key is absent.
     * @throws SecretStoreException    If the secret store cannot be reached or answers with an error.
     */
    Map<String, String> getSecrets(String subPath, String... keys) throws SecretStoreException;
}
