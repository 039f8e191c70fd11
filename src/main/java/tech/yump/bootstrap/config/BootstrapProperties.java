package tech.yump.bootstrap.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.bootstrap.credentials.DatabaseInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the secret bootstrap service under the 'bootstrap' prefix.
 */
@ConfigurationProperties(prefix = "bootstrap")
@Validated
public record BootstrapProperties(

        // Insecure / local-development escape hatch. Skips every secret-store interaction.
        boolean securityDisabled,

        @Valid
        WritableInfo writable,

        @Valid
        ServiceInfo service,

        @Valid
        @NotNull(message = "Secret store configuration (bootstrap.secret-store) is required.")
        SecretStoreInfo secretStore,

        @Valid
        Map<String, DatabaseInfo> databases,

        @Valid
        StartupProperties startup
) {
    public BootstrapProperties {
        if (writable == null) {
            writable = new WritableInfo(null);
        }
        if (service == null) {
            service = new ServiceInfo(null, 0, null);
        }
        databases = databases == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(databases));
        if (startup == null) {
            startup = new StartupProperties(false, false);
        }
    }

    /**
     * Settings that may change while the service runs.
     */
    @Validated
    public record WritableInfo(
            String logLevel
    ) {}

    @Validated
    public record ServiceInfo(
            String host,
            int port,
            String startupMsg
    ) {}

    /**
     * Work performed once while the application starts.
     */
    @Validated
    public record StartupProperties(
            boolean fetchCredentials,
            boolean launchTokenProvider
    ) {}

    @AssertTrue(message = "Secret store token file (bootstrap.secret-store.token-file) must be provided when credentials are fetched at startup with security enabled.")
    private boolean isTokenFileValid() {
        if (!startup.fetchCredentials() || securityDisabled || secretStore == null) {
            return true;
        }
        return StringUtils.hasText(secretStore.tokenFile());
    }

    @AssertTrue(message = "Secret store host (bootstrap.secret-store.host) must be provided when credentials are fetched at startup with security enabled.")
    private boolean isHostValid() {
        if (!startup.fetchCredentials() || securityDisabled || secretStore == null) {
            return true;
        }
        return StringUtils.hasText(secretStore.host());
    }
}
