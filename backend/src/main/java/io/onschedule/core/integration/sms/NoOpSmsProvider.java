package io.onschedule.core.integration.sms;

import io.onschedule.core.integration.email.SendResult;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs text messages instead of sending them. */
public class NoOpSmsProvider implements SmsProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpSmsProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult send(SmsMessage message) {
    log.info(
        "NoOp SMS: would send {} character(s) to {}",
        message.body().length(),
        PhoneNumbers.mask(message.to()));
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }
}
