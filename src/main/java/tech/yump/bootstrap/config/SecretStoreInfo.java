package tech.yump.bootstrap.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Connection and token-provider settings for the secret store, bound from {@code bootstrap.secret-store}.
 *
 * @param host              secret-store host name.
 * @param port              secret-store port.
 * @param path              base path every secret sub-path is appended to (e.g. {@code /v1/secret/edgex/core-data}).
 * @param protocol          scheme used by clients built from this info; credential bootstrap always uses https.
 * @param serverName        TLS server name (SNI) presented to the secret store.
 * @param rootCaCertPath    PEM file with the CA certificates trusted for the secret store.
 * @param tokenFile         token file produced by secret-store initialization for this service.
 * @param tokenProvider     executable name (resolved on PATH) or path of the token provider.
 * @param tokenProviderType launch model of the token provider; only {@code oneshot} is supported.
 * @param tokenProviderArgs arguments for the provider's own start-up launch.
 */
@Validated
public record SecretStoreInfo(
        String host,

        @Min(value = 0, message = "Secret store port (bootstrap.secret-store.port) must not be negative.")
        @Max(value = 65535, message = "Secret store port (bootstrap.secret-store.port) must be at most 65535.")
        int port,

        String path,
        String protocol,
        String serverName,
        String rootCaCertPath,
        String tokenFile,
        String tokenProvider,
        String tokenProviderType,
        List<String> tokenProviderArgs
) {
    public SecretStoreInfo {
        if (tokenProviderArgs == null) {
            tokenProviderArgs = List.of();
        } else {
            tokenProviderArgs = List.copyOf(tokenProviderArgs);
        }
    }
}
