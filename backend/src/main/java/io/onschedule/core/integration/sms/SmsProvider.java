package io.onschedule.core.integration.sms;

import io.onschedule.core.integration.email.SendResult;

/** Port for sending text messages via an external provider. */
public interface SmsProvider {

  /** Provider identifier (e.g., "twilio", "noop"). */
  String providerId();

  SendResult send(SmsMessage message);
}
