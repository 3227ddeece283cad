package io.onschedule.core.integration.sms;

/** Helpers for handling phone numbers in logs. */
public final class PhoneNumbers {

  private PhoneNumbers() {}

  /**
   * Masks all but the last four characters, e.g. {@code +15551234567} becomes {@code
   * ********4567}.
   */
  public static String mask(String phone) {
    if (phone == null || phone.isBlank()) {
      return "";
    }
    String trimmed = phone.strip();
    if (trimmed.length() <= 4) {
      return "*".repeat(trimmed.length());
    }
    return "*".repeat(trimmed.length() - 4) + trimmed.substring(trimmed.length() - 4);
  }
}
