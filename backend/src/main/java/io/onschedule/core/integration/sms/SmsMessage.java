package io.onschedule.core.integration.sms;

import java.util.Objects;

public record SmsMessage(String to, String body) {

  public SmsMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(body, "body");
  }
}
