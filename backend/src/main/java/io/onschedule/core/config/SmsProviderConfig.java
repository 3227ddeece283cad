package io.onschedule.core.config;

import io.onschedule.core.integration.sms.NoOpSmsProvider;
import io.onschedule.core.integration.sms.SmsProvider;
import io.onschedule.core.integration.sms.TwilioSmsProvider;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SmsProperties.class)
public class SmsProviderConfig {

  private static final Logger log = LoggerFactory.getLogger(SmsProviderConfig.class);

  @Bean
  SmsProvider smsProvider(SmsProperties smsProperties) {
    SmsProvider provider =
        switch (smsProperties.provider().toLowerCase(Locale.ROOT)) {
          case "twilio" -> new TwilioSmsProvider(smsProperties);
          case "noop" -> new NoOpSmsProvider();
          default ->
              throw new IllegalStateException("Unknown SMS provider: " + smsProperties.provider());
        };
    log.info("Using {} as SMS provider", provider.providerId());
    return provider;
  }
}
