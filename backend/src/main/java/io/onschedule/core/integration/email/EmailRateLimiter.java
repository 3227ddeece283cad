package io.onschedule.core.integration.email;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.onschedule.core.config.EmailProperties;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Hourly send counters per provider. A send over the limit is refused rather than queued. */
@Service
public class EmailRateLimiter {

  private final int sendgridLimit;
  private final int sesLimit;
  private final int defaultLimit;
  private final Cache<String, AtomicInteger> providerCounters;

  @Autowired
  public EmailRateLimiter(EmailProperties emailProperties) {
    this(
        emailProperties.rateLimit().sendgrid(),
        emailProperties.rateLimit().ses(),
        emailProperties.rateLimit().noop(),
        Ticker.systemTicker());
  }

  EmailRateLimiter(int sendgridLimit, int sesLimit, int defaultLimit, Ticker ticker) {
    this.sendgridLimit = sendgridLimit;
    this.sesLimit = sesLimit;
    this.defaultLimit = defaultLimit;
    this.providerCounters =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(100)
            .ticker(ticker)
            .build();
  }

  public boolean tryAcquire(String providerId) {
    int limit = getLimitForProvider(providerId);
    var counter = providerCounters.get("provider:" + providerId, k -> new AtomicInteger(0));
    if (counter.incrementAndGet() > limit) {
      counter.decrementAndGet();
      return false;
    }
    return true;
  }

  public RateLimitStatus getStatus(String providerId) {
    int limit = getLimitForProvider(providerId);
    var counter = providerCounters.getIfPresent("provider:" + providerId);
    int currentCount = counter != null ? counter.get() : 0;
    return new RateLimitStatus(currentCount, limit, currentCount < limit);
  }

  private int getLimitForProvider(String providerId) {
    return switch (providerId) {
      case "sendgrid" -> sendgridLimit;
      case "ses" -> sesLimit;
      default -> defaultLimit;
    };
  }

  public record RateLimitStatus(int currentCount, int limit, boolean allowed) {}
}
