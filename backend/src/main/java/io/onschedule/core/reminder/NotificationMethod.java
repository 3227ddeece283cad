package io.onschedule.core.reminder;

public enum NotificationMethod {
  EMAIL,
  SMS,
  BOTH;

  public boolean includesEmail() {
    return this == EMAIL || this == BOTH;
  }

  public boolean includesSms() {
    return this == SMS || this == BOTH;
  }
}
