package io.onschedule.core.reminder;

import static org.assertj.core.api.Assertions.assertThat;

import io.onschedule.core.inspection.InspectionType;
import org.junit.jupiter.api.Test;

class ReminderTypeTest {

  @Test
  void leadDays_onlyForDaysBeforeKinds() {
    assertThat(ReminderType.DAYS_2_BEFORE.leadDays()).isEqualTo(2);
    assertThat(ReminderType.DAYS_15_BEFORE.leadDays()).isEqualTo(15);
    assertThat(ReminderType.DAYS_30_BEFORE.leadDays()).isEqualTo(30);
    assertThat(ReminderType.WEEKLY.leadDays()).isZero();
    assertThat(ReminderType.ANNUAL.leadDays()).isZero();
    assertThat(ReminderType.ONE_TIME.leadDays()).isZero();
  }

  @Test
  void forInspectionType_mirrorsRecurringKinds() {
    assertThat(ReminderType.forInspectionType(InspectionType.WEEKLY))
        .isEqualTo(ReminderType.WEEKLY);
    assertThat(ReminderType.forInspectionType(InspectionType.SEMI_ANNUAL))
        .isEqualTo(ReminderType.SEMI_ANNUAL);
    assertThat(ReminderType.forInspectionType(InspectionType.ANNUAL))
        .isEqualTo(ReminderType.ANNUAL);
  }

  @Test
  void forInspectionType_mapsOthersToOneTime() {
    assertThat(ReminderType.forInspectionType(InspectionType.SAFETY))
        .isEqualTo(ReminderType.ONE_TIME);
    assertThat(ReminderType.forInspectionType(InspectionType.DAILY))
        .isEqualTo(ReminderType.ONE_TIME);
  }

  @Test
  void notificationConfigOf_defaultsToTemplateMode() {
    var config =
        NotificationConfig.of(NotificationMethod.EMAIL, null, null, null, null, "ignored text");

    assertThat(config.message()).isInstanceOf(ReminderMessage.TemplateMessage.class);
    assertThat(config.message().source()).isEqualTo(MessageSource.TEMPLATE);
  }
}
