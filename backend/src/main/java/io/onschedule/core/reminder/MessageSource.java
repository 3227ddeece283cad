package io.onschedule.core.reminder;

public enum MessageSource {
  TEMPLATE,
  MANUAL
}
