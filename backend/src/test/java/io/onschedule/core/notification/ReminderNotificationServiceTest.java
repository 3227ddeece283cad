package io.onschedule.core.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.onschedule.core.config.SmsProperties;
import io.onschedule.core.notification.template.FallbackEmailRenderer;
import io.onschedule.core.reminder.NotificationMethod;
import io.onschedule.core.reminder.Reminder;
import io.onschedule.core.reminder.ReminderMessage;
import io.onschedule.core.reminder.ReminderType;
import io.onschedule.core.template.EmailTemplate;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReminderNotificationServiceTest {

  private static final UUID INSPECTION_ID = UUID.randomUUID();

  @Mock private ReminderContextLoader contextLoader;
  @Mock private BulkEmailSender bulkEmailSender;
  @Mock private BulkSmsSender bulkSmsSender;

  private ReminderNotificationService service;

  @BeforeEach
  void setUp() {
    var contentBuilder =
        new ReminderContentBuilder(
            new SmsProperties("noop", null, null, null, null, Duration.ZERO, 120));
    service =
        new ReminderNotificationService(
            contextLoader,
            contentBuilder,
            new FallbackEmailRenderer(),
            bulkEmailSender,
            bulkSmsSender);
  }

  @Test
  void sendReminderEmail_manualMessage_sendsPlainTextToClientAndInspectors() {
    var ctx = ReminderContentBuilderTest.context("Plant room", "Boiler 1");
    when(contextLoader.load(INSPECTION_ID)).thenReturn(Optional.of(ctx));
    var sent = BatchSummary.of(List.of());
    when(bulkEmailSender.send(anyList(), any())).thenReturn(sent);

    var summary = service.sendReminderEmail(INSPECTION_ID);

    var email = ArgumentCaptor.forClass(ReminderEmail.class);
    verify(bulkEmailSender)
        .send(eq(List.of("ops@acme.test", "jane@acme.test", "sam@acme.test")), email.capture());
    assertThat(summary).isSameAs(sent);
    assertThat(email.getValue().usesProviderTemplate()).isFalse();
    assertThat(email.getValue().content().subject())
        .isEqualTo("Inspection Reminder - Acme Facilities");
    assertThat(email.getValue().content().plainTextBody()).contains("Please bring the keys");
  }

  @Test
  void sendReminderEmail_templateMode_usesHostedTemplateWithRenderedFallback() {
    var base = ReminderContentBuilderTest.context("Plant room", "Boiler 1");
    var template =
        new EmailTemplate(
            "Monthly", "Reminder for {{companyName}}", "<p>Due {{inspectionDate}}</p>", "d-abc");
    var ctx = withTemplate(base, template);
    when(contextLoader.load(INSPECTION_ID)).thenReturn(Optional.of(ctx));
    when(bulkEmailSender.send(anyList(), any())).thenReturn(BatchSummary.empty());

    service.sendReminderEmail(INSPECTION_ID);

    var email = ArgumentCaptor.forClass(ReminderEmail.class);
    verify(bulkEmailSender).send(anyList(), email.capture());
    assertThat(email.getValue().providerTemplateId()).isEqualTo("d-abc");
    assertThat(email.getValue().templateData())
        .containsEntry("companyName", "Acme Facilities")
        .containsEntry("inspectionDate", "05 Mar 2024");
    assertThat(email.getValue().content().subject()).isEqualTo("Reminder for Acme Facilities");
    assertThat(email.getValue().content().htmlBody()).contains("Due 05 Mar 2024");
  }

  @Test
  void sendReminderEmail_templateMissing_sendsNothing() {
    var ctx = withTemplate(ReminderContentBuilderTest.context("Plant room", "Boiler 1"), null);
    when(contextLoader.load(INSPECTION_ID)).thenReturn(Optional.of(ctx));

    var summary = service.sendReminderEmail(INSPECTION_ID);

    assertThat(summary.total()).isZero();
    verify(bulkEmailSender, never()).send(anyList(), any());
  }

  @Test
  void sendReminderEmail_smsOnlyReminder_sendsNothing() {
    var base = ReminderContentBuilderTest.context("Plant room", "Boiler 1");
    var reminder =
        new Reminder(
            base.inspection().getClientId(),
            base.inspection().getAssetId(),
            ReminderType.MONTHLY,
            base.inspection().getDueDate(),
            NotificationMethod.SMS,
            new ReminderMessage.ManualMessage("Please bring the keys"),
            null);
    var ctx =
        new ReminderContext(
            base.inspection(), base.client(), base.asset(), base.inspectors(), reminder, null);
    when(contextLoader.load(INSPECTION_ID)).thenReturn(Optional.of(ctx));

    assertThat(service.sendReminderEmail(INSPECTION_ID).total()).isZero();
    verify(bulkEmailSender, never()).send(anyList(), any());
  }

  @Test
  void sendReminderEmail_contextMissing_returnsEmptySummary() {
    when(contextLoader.load(INSPECTION_ID)).thenReturn(Optional.empty());

    assertThat(service.sendReminderEmail(INSPECTION_ID)).isEqualTo(BatchSummary.empty());
    verify(bulkEmailSender, never()).send(anyList(), any());
  }

  @Test
  void sendSmsReminder_sendsToPhonesWithAppendedDetails() {
    var ctx = ReminderContentBuilderTest.context("Plant room", "Boiler 1");
    when(contextLoader.load(INSPECTION_ID)).thenReturn(Optional.of(ctx));
    when(bulkSmsSender.send(anyList(), anyString())).thenReturn(BatchSummary.empty());

    service.sendSmsReminder(INSPECTION_ID);

    verify(bulkSmsSender)
        .send(
            List.of("+15550001111", "+15550002222"),
            "Please bring the keys\n\nDate: 05 Mar 2024\nAsset: Boiler 1");
  }

  private static ReminderContext withTemplate(ReminderContext base, EmailTemplate template) {
    var reminder =
        new Reminder(
            base.inspection().getClientId(),
            base.inspection().getAssetId(),
            ReminderType.MONTHLY,
            base.inspection().getDueDate(),
            NotificationMethod.EMAIL,
            new ReminderMessage.TemplateMessage(UUID.randomUUID(), null),
            null);
    return new ReminderContext(
        base.inspection(), base.client(), base.asset(), base.inspectors(), reminder, template);
  }
}
