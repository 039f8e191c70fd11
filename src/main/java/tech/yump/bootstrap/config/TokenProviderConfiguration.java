package tech.yump.bootstrap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.bootstrap.provider.ExecRunner;
import tech.yump.bootstrap.provider.OsExecRunner;
import tech.yump.bootstrap.token.FileTokenLoader;
import tech.yump.bootstrap.token.TokenFileLoader;

@Configuration
@Slf4j
public class TokenProviderConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public ExecRunner execRunner() {
    return new OsExecRunner();
  }

  // Replaced when the application supplies its own loader.
  @Bean
  @ConditionalOnMissingBean
  public TokenFileLoader tokenFileLoader(ObjectMapper objectMapper) {
    log.debug("Using file based token loader.");
    return new FileTokenLoader(objectMapper);
  }
}
