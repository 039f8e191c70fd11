package tech.yump.bootstrap.credentials;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.bootstrap.config.SecretStoreInfo;
import tech.yump.bootstrap.secretstore.SecretStoreClient;
import tech.yump.bootstrap.secretstore.SecretStoreClientConfig;
import tech.yump.bootstrap.secretstore.SecretStoreClientFactory;
import tech.yump.bootstrap.secretstore.SecretStoreException;
import tech.yump.bootstrap.token.TokenFileException;
import tech.yump.bootstrap.token.TokenFileLoader;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a loaded configuration into per-database credentials, reading them from the secret store
 * with the service's own token, or returning the configured values when security is disabled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CredentialBootstrapper {

    static final String USERNAME_KEY = "username";
    static final String PASSWORD_KEY = "password";

    private final TokenFileLoader tokenFileLoader;
    private final SecretStoreClientFactory secretStoreClientFactory;

    /**
     * Resolves credentials for every database named in {@code config.getDatabases()}.
     * On success the returned map also replaces {@code config.getDatabases()}.
     *
     * @param config The service configuration.
     * @return Credentials keyed by database name.
     * @throws CredentialBootstrapException If the token, the client, or any single database's secret cannot be obtained.
     */
    public Map<String, DatabaseInfo> getCredentials(CredentialConfiguration config) throws CredentialBootstrapException {
        Map<String, DatabaseInfo> configured = config.getDatabases() != null ? config.getDatabases() : Collections.emptyMap();

        if (config.isSecurityDisabled()) {
            log.info("Security is disabled; using configured credentials for databases {}", configured.keySet());
            return configured;
        }

        SecretStoreInfo secretStore = config.getSecretStore();
        if (secretStore == null) {
            throw new CredentialBootstrapException("secret store configuration is required when security is enabled");
        }

        String token = loadToken(secretStore.tokenFile());

        SecretStoreClient client;
        try {
            client = secretStoreClientFactory.create(SecretStoreClientConfig.secureTokenConfig(secretStore, token));
        } catch (SecretStoreException e) {
            log.error("Unable to create secret store client for {}:{}: {}", secretStore.host(), secretStore.port(), e.getMessage());
            throw new CredentialBootstrapException("failed to create secret store client: " + e.getMessage(), e);
        }

        Map<String, DatabaseInfo> credentials = new LinkedHashMap<>();
        for (String databaseName : configured.keySet()) {
            String subPath = "/" + databaseName;
            Map<String, String> secrets;
            try {
                secrets = client.getSecrets(subPath, USERNAME_KEY, PASSWORD_KEY);
            } catch (SecretStoreException e) {
                log.error("Unable to retrieve credentials for database '{}' from '{}': {}", databaseName, subPath, e.getMessage());
                throw new CredentialBootstrapException(
                        "failed to retrieve credentials for database '" + databaseName + "': " + e.getMessage(), e);
            }
            credentials.put(databaseName, new DatabaseInfo(secrets.get(USERNAME_KEY), secrets.get(PASSWORD_KEY)));
            log.debug("Retrieved credentials for database '{}'", databaseName);
        }

        config.setDatabases(credentials);
        log.info("Retrieved credentials for {} database(s) from the secret store", credentials.size());
        return credentials;
    }

    private String loadToken(String tokenFile) {
        if (!StringUtils.hasText(tokenFile)) {
            throw new CredentialBootstrapException("secret store token file is not configured");
        }
        try {
            return tokenFileLoader.load(Path.of(tokenFile));
        } catch (TokenFileException | InvalidPathException e) {
            log.error("Unable to load secret store token from {}: {}", tokenFile, e.getMessage());
            throw new CredentialBootstrapException("failed to load secret store token from " + tokenFile + ": " + e.getMessage(), e);
        }
    }
}
