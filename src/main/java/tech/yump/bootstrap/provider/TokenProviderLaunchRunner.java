package tech.yump.bootstrap.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.bootstrap.audit.AuditHelper;
import tech.yump.bootstrap.config.BootstrapProperties;
import tech.yump.bootstrap.config.SecretStoreInfo;

import java.util.HashMap;
import java.util.Map;

/**
 * Runs the configured token provider once while the service starts, so that every
 * service token exists before credentials are fetched.
 */
@Component
@Order(10)
@ConditionalOnProperty(prefix = "bootstrap.startup", name = "launch-token-provider", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class TokenProviderLaunchRunner implements ApplicationRunner {

    private final BootstrapProperties properties;
    private final TokenProviderFactory tokenProviderFactory;
    private final AuditHelper auditHelper;

    @Override
    public void run(ApplicationArguments args) {
        SecretStoreInfo secretStoreInfo = properties.secretStore();
        if (!StringUtils.hasText(secretStoreInfo.tokenProvider())) {
            log.info("no token provider configured");
            return;
        }

        Map<String, Object> data = new HashMap<>();
        data.put("token_provider", secretStoreInfo.tokenProvider());

        try (CancellationSignal signal = tokenProviderFactory.newSignal()) {
            TokenProvider tokenProvider = tokenProviderFactory.create(signal);
            tokenProvider.setConfiguration(secretStoreInfo);
            tokenProvider.launch();
        } catch (TokenProviderException e) {
            log.error("Token provider launch failed: {}", e.getMessage());
            data.put("error", e.getMessage());
            auditHelper.logInternalEvent("token_operation", "launch_provider", "failure", data);
            throw e;
        }

        auditHelper.logInternalEvent("token_operation", "launch_provider", "success", data);
    }
}
