package io.onschedule.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Email delivery settings. {@code primary} selects the adapter used for every reminder; {@code
 * fallback} receives only the recipients the primary rejected as unauthorized.
 */
@ConfigurationProperties(prefix = "onschedule.email")
public record EmailProperties(
    @DefaultValue("noop") String primary,
    @DefaultValue("noop") String fallback,
    @DefaultValue("noreply@onschedule.io") String senderAddress,
    @DefaultValue("OnSchedule") String senderName,
    String replyTo,
    @DefaultValue("50") int batchSize,
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("1s") Duration retryBaseDelay,
    @DefaultValue("10s") Duration requestTimeout,
    @DefaultValue SendGrid sendgrid,
    @DefaultValue Ses ses,
    @DefaultValue RateLimit rateLimit) {

  public record SendGrid(String apiKey) {}

  public record Ses(String region, String accessKeyId, String secretAccessKey) {}

  /** Per-provider sends allowed in a rolling hour. */
  public record RateLimit(
      @DefaultValue("1000") int sendgrid,
      @DefaultValue("1000") int ses,
      @DefaultValue("100000") int noop) {}
}
