package tech.yump.bootstrap.credentials;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import tech.yump.bootstrap.config.BootstrapProperties;
import tech.yump.bootstrap.config.SecretStoreInfo;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The loaded service configuration the credential bootstrap works on.
 * {@code databases} lists which databases need credentials and is replaced by the fetched set
 * after a successful secure bootstrap.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CredentialConfiguration {

    private BootstrapProperties.WritableInfo writable;
    private BootstrapProperties.ServiceInfo service;
    private SecretStoreInfo secretStore;
    private Map<String, DatabaseInfo> databases;
    private boolean securityDisabled;

    public static CredentialConfiguration from(BootstrapProperties properties) {
        return new CredentialConfiguration(
                properties.writable(),
                properties.service(),
                properties.secretStore(),
                new LinkedHashMap<>(properties.databases()),
                properties.securityDisabled()
        );
    }
}
