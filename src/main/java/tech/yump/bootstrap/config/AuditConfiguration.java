package tech.yump.bootstrap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.bootstrap.audit.AuditBackend;
import tech.yump.bootstrap.audit.LogAuditBackend;

@Configuration
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    public AuditConfiguration(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    @ConditionalOnProperty(name = "bootstrap.audit.backend", havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }
}
