package io.onschedule.core.config;

import io.onschedule.core.integration.email.EmailProvider;
import io.onschedule.core.integration.email.NoOpEmailProvider;
import io.onschedule.core.integration.email.SendGridEmailProvider;
import io.onschedule.core.integration.email.SesEmailProvider;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the primary and fallback email providers from {@code onschedule.email.primary} and {@code
 * onschedule.email.fallback}. A selected provider with missing credentials fails startup.
 */
@Configuration
@EnableConfigurationProperties(EmailProperties.class)
public class EmailProviderConfig {

  private static final Logger log = LoggerFactory.getLogger(EmailProviderConfig.class);

  @Bean
  EmailProvider primaryEmailProvider(EmailProperties emailProperties) {
    return create(emailProperties.primary(), emailProperties, "primary");
  }

  @Bean
  EmailProvider fallbackEmailProvider(EmailProperties emailProperties) {
    return create(emailProperties.fallback(), emailProperties, "fallback");
  }

  private static EmailProvider create(String slug, EmailProperties properties, String role) {
    EmailProvider provider =
        switch (slug.toLowerCase(Locale.ROOT)) {
          case "sendgrid" -> new SendGridEmailProvider(properties);
          case "ses" -> new SesEmailProvider(properties);
          case "noop" -> new NoOpEmailProvider();
          default -> throw new IllegalStateException("Unknown email provider: " + slug);
        };
    log.info("Using {} as {} email provider", provider.providerId(), role);
    return provider;
  }
}
