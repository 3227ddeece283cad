package io.onschedule.core.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.onschedule.core.config.SmsProperties;
import io.onschedule.core.integration.email.SendResult;
import io.onschedule.core.integration.sms.SmsMessage;
import io.onschedule.core.integration.sms.SmsProvider;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class BulkSmsSenderTest {

  private final SmsProvider provider = mock(SmsProvider.class);
  private final BulkSmsSender sender =
      new BulkSmsSender(
          provider, new SmsProperties("twilio", null, null, null, null, Duration.ZERO, 120));

  @Test
  void send_reportsOneResultPerNumberInOrder() {
    when(provider.providerId()).thenReturn("twilio");
    when(provider.send(any(SmsMessage.class)))
        .thenReturn(new SendResult(true, "SM1", null))
        .thenReturn(new SendResult(false, null, "invalid number"))
        .thenThrow(new IllegalStateException("timeout"));

    var summary = sender.send(List.of("+15550000001", "+15550000002", "+15550000003"), "Hello");

    assertThat(summary.total()).isEqualTo(3);
    assertThat(summary.success()).isEqualTo(1);
    assertThat(summary.results())
        .extracting(NotificationResult::error)
        .containsExactly(null, "invalid number", "timeout");
    assertThat(summary.results()).allMatch(r -> r.providerId().equals("twilio"));
    verify(provider, times(3)).send(any(SmsMessage.class));
  }

  @Test
  void send_noNumbers_returnsEmptySummary() {
    when(provider.providerId()).thenReturn("twilio");

    var summary = sender.send(List.of(), "Hello");

    assertThat(summary.total()).isZero();
  }
}
