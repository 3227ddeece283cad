package io.onschedule.core.notification;

import io.onschedule.core.config.SmsProperties;
import io.onschedule.core.integration.email.SendResult;
import io.onschedule.core.integration.sms.PhoneNumbers;
import io.onschedule.core.integration.sms.SmsMessage;
import io.onschedule.core.integration.sms.SmsProvider;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Sends one text message to many numbers, one at a time with a pause between sends. */
@Component
public class BulkSmsSender {

  private static final Logger log = LoggerFactory.getLogger(BulkSmsSender.class);

  private final SmsProvider smsProvider;
  private final Duration interSendDelay;

  public BulkSmsSender(SmsProvider smsProvider, SmsProperties smsProperties) {
    this.smsProvider = smsProvider;
    this.interSendDelay = smsProperties.interSendDelay();
  }

  public BatchSummary send(List<String> phoneNumbers, String body) {
    String providerId = smsProvider.providerId();
    List<NotificationResult> results = new ArrayList<>(phoneNumbers.size());
    for (int i = 0; i < phoneNumbers.size(); i++) {
      String to = phoneNumbers.get(i);
      if (i > 0 && !pause()) {
        log.warn("SMS batch interrupted, {} message(s) not sent", phoneNumbers.size() - i);
        for (String remaining : phoneNumbers.subList(i, phoneNumbers.size())) {
          results.add(NotificationResult.failure(remaining, "Interrupted", providerId));
        }
        break;
      }
      try {
        SendResult result = smsProvider.send(new SmsMessage(to, body));
        if (result.success()) {
          log.debug("SMS sent to {}", PhoneNumbers.mask(to));
        } else {
          log.warn("SMS to {} failed: {}", PhoneNumbers.mask(to), result.errorMessage());
        }
        results.add(NotificationResult.from(to, result, providerId));
      } catch (RuntimeException e) {
        log.error("SMS to {} via {} failed: {}", PhoneNumbers.mask(to), providerId, e.getMessage());
        results.add(NotificationResult.failure(to, e.getMessage(), providerId));
      }
    }

    var summary = BatchSummary.of(results);
    log.info(
        "SMS batch finished: {} sent, {} failed, {} total",
        summary.success(),
        summary.failed(),
        summary.total());
    return summary;
  }

  private boolean pause() {
    if (interSendDelay.isZero() || interSendDelay.isNegative()) {
      return true;
    }
    try {
      Thread.sleep(interSendDelay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
