package io.onschedule.core.integration.email;

/**
 * Outcome of a single provider send.
 *
 * @param unauthorized the provider refused the sender or credentials; such sends are eligible for
 *     the fallback provider and are never retried against the same provider
 */
public record SendResult(
    boolean success, String providerMessageId, String errorMessage, boolean unauthorized) {

  public SendResult(boolean success, String providerMessageId, String errorMessage) {
    this(success, providerMessageId, errorMessage, false);
  }

  public static SendResult unauthorized(String errorMessage) {
    return new SendResult(false, null, errorMessage, true);
  }
}
