package io.confhub.backend.config;

import io.confhub.backend.email.EmailProvider;
import io.confhub.backend.email.NoOpEmailProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EmailConfig {

  @Bean
  @ConditionalOnMissingBean(EmailProvider.class)
  EmailProvider noOpEmailProvider() {
    return new NoOpEmailProvider();
  }
}
