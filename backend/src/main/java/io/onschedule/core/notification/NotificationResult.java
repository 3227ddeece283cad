package io.onschedule.core.notification;

import io.onschedule.core.integration.email.SendResult;

/** Delivery outcome for one recipient. */
public record NotificationResult(
    String recipient, boolean success, String providerMessageId, String error, String providerId) {

  public static NotificationResult from(String recipient, SendResult result, String providerId) {
    return new NotificationResult(
        recipient, result.success(), result.providerMessageId(), result.errorMessage(), providerId);
  }

  public static NotificationResult failure(String recipient, String error, String providerId) {
    return new NotificationResult(recipient, false, null, error, providerId);
  }
}
