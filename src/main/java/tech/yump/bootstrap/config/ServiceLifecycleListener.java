package tech.yump.bootstrap.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Applies the writable settings and announces the service once it is ready to serve.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ServiceLifecycleListener {

    static final String SERVICE_LOGGER = "tech.yump.bootstrap";

    private final BootstrapProperties properties;
    private final LoggingSystem loggingSystem;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        applyLogLevel(properties.writable().logLevel());

        BootstrapProperties.ServiceInfo service = properties.service();
        if (StringUtils.hasText(service.startupMsg())) {
            log.info("{}", service.startupMsg());
        }
        log.info("Service ready on {}:{}", service.host(), service.port());
    }

    void applyLogLevel(String logLevel) {
        if (!StringUtils.hasText(logLevel)) {
            return;
        }
        LogLevel level;
        try {
            level = LogLevel.valueOf(logLevel.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown log level '{}'", logLevel);
            return;
        }
        loggingSystem.setLogLevel(SERVICE_LOGGER, level);
        log.info("Log level of {} set to {}", SERVICE_LOGGER, level);
    }
}
