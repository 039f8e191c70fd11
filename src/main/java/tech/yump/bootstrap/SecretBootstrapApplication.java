package tech.yump.bootstrap;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.bootstrap.config.BootstrapProperties;

@Slf4j
@SpringBootApplication(
        exclude = { UserDetailsServiceAutoConfiguration.class }
)
@EnableConfigurationProperties(BootstrapProperties.class)
public class SecretBootstrapApplication {

  public static void main(String[] args) {
    SpringApplication.run(SecretBootstrapApplication.class, args);
    log.info(">>> Secret Bootstrap Application Started <<<");
  }
}
