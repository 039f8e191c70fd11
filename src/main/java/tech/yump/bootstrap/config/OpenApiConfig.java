package tech.yump.bootstrap.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(
            @Value("${spring.application.name:secret-bootstrap}") String serviceName,
            @Value("${bootstrap.version:0.1.0-SNAPSHOT}") String version) {
        // No security scheme: every documented route is open.
        return new OpenAPI()
                .info(new Info()
                        .title(serviceName)
                        .version(version)
                        .description("Secret-store token regeneration and common service routes."));
    }
}
