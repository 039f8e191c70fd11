package tech.yump.bootstrap.credentials;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import tech.yump.bootstrap.audit.AuditHelper;
import tech.yump.bootstrap.config.BootstrapProperties;

import java.util.List;
import java.util.Map;

/**
 * Fetches the service's database credentials once at start-up and publishes them to the
 * {@link DatabaseCredentialRegistry}. A failure aborts start-up; there is no retry here.
 */
@Slf4j
@Component
@Order(20)
@RequiredArgsConstructor
@ConditionalOnProperty(name = "bootstrap.startup.fetch-credentials", havingValue = "true")
public class CredentialBootstrapRunner implements ApplicationRunner {

    private final BootstrapProperties properties;
    private final CredentialBootstrapper credentialBootstrapper;
    private final DatabaseCredentialRegistry credentialRegistry;
    private final AuditHelper auditHelper;

    @Override
    public void run(ApplicationArguments args) {
        CredentialConfiguration configuration = CredentialConfiguration.from(properties);
        List<String> databaseNames = List.copyOf(configuration.getDatabases().keySet());
        log.info("Bootstrapping credentials for databases {}", databaseNames);

        Map<String, DatabaseInfo> credentials;
        try {
            credentials = credentialBootstrapper.getCredentials(configuration);
        } catch (CredentialBootstrapException e) {
            auditHelper.logInternalEvent("credential_bootstrap", "fetch_credentials", "failure",
                    Map.of("databases", databaseNames, "error", e.getMessage()));
            throw e;
        }

        credentialRegistry.publish(credentials);
        auditHelper.logInternalEvent("credential_bootstrap", "fetch_credentials", "success",
                Map.of("databases", databaseNames, "security_disabled", configuration.isSecurityDisabled()));
    }
}
