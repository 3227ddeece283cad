package io.onschedule.core.integration.sms;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PhoneNumbersTest {

  @Test
  void mask_keepsLastFourDigits() {
    assertThat(PhoneNumbers.mask("+15551234567")).isEqualTo("********4567");
    assertThat(PhoneNumbers.mask(" 0712345678 ")).isEqualTo("******5678");
  }

  @Test
  void mask_shortOrMissingNumbers() {
    assertThat(PhoneNumbers.mask("123")).isEqualTo("***");
    assertThat(PhoneNumbers.mask(null)).isEmpty();
    assertThat(PhoneNumbers.mask("  ")).isEmpty();
  }
}
