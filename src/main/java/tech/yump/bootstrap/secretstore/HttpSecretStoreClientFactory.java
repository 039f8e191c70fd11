package tech.yump.bootstrap.secretstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Builds {@link HttpSecretStoreClient}s, trusting the configured root CA and presenting the configured server name.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpSecretStoreClientFactory implements SecretStoreClientFactory {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final ObjectMapper objectMapper;

    @Override
    public SecretStoreClient create(SecretStoreClientConfig config) throws SecretStoreException {
        if (!StringUtils.hasText(config.host())) {
            throw new SecretStoreException("secret store host must be configured");
        }

        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (SecretStoreClientConfig.HTTPS.equalsIgnoreCase(config.protocol())) {
            builder.sslContext(buildSslContext(config.rootCaCertPath()));
            if (StringUtils.hasText(config.serverName())) {
                SSLParameters sslParameters = new SSLParameters();
                try {
                    sslParameters.setServerNames(List.of(new SNIHostName(config.serverName())));
                } catch (IllegalArgumentException e) {
                    throw new SecretStoreException("invalid secret store server name '" + config.serverName() + "': " + e.getMessage(), 0, e);
                }
                builder.sslParameters(sslParameters);
            }
        }

        log.debug("Creating secret store client for {}", config.baseUrl());
        try {
            return new HttpSecretStoreClient(builder.build(), objectMapper, config);
        } catch (IllegalArgumentException e) {
            throw new SecretStoreException("failed to create secret store client: " + e.getMessage(), 0, e);
        }
    }

    private SSLContext buildSslContext(String rootCaCertPath) {
        try {
            if (!StringUtils.hasText(rootCaCertPath)) {
                return SSLContext.getDefault();
            }
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);

            CertificateFactory certificateFactory = CertificateFactory.getInstance("X.509");
            Collection<? extends Certificate> certificates;
            try (InputStream in = Files.newInputStream(Path.of(rootCaCertPath))) {
                certificates = certificateFactory.generateCertificates(in);
            }
            if (certificates.isEmpty()) {
                throw new SecretStoreException("no CA certificates found in " + rootCaCertPath);
            }
            int index = 0;
            for (Certificate certificate : certificates) {
                trustStore.setCertificateEntry("secret-store-ca-" + index++, certificate);
            }

            TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagerFactory.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, trustManagerFactory.getTrustManagers(), null);
            log.debug("Loaded {} CA certificate(s) from {}", certificates.size(), rootCaCertPath);
            return sslContext;
        } catch (IOException e) {
            throw new SecretStoreException("failed to read root CA certificate " + rootCaCertPath + ": " + e.getMessage(), 0, e);
        } catch (GeneralSecurityException e) {
            throw new SecretStoreException("failed to load root CA certificate " + rootCaCertPath + ": " + e.getMessage(), 0, e);
        }
    }
}
