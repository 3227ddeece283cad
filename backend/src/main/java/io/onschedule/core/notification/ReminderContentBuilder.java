package io.onschedule.core.notification;

import io.onschedule.core.config.SmsProperties;
import io.onschedule.core.employee.Employee;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Builds reminder subjects, bodies and template variables from a {@link ReminderContext}. */
@Component
public class ReminderContentBuilder {

  static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

  private final int shortMessageThreshold;

  public ReminderContentBuilder(SmsProperties smsProperties) {
    this.shortMessageThreshold = smsProperties.shortMessageThreshold();
  }

  /** Variables exposed to email templates, hosted or compiled locally. */
  public Map<String, Object> templateVariables(ReminderContext ctx) {
    var variables = new LinkedHashMap<String, Object>();
    variables.put("companyName", nullToEmpty(ctx.client().getCompany()));
    variables.put("inspectionDate", formattedDate(ctx));
    variables.put("assetName", ctx.asset().getLabel());
    variables.put("location", location(ctx));
    variables.put(
        "inspectorNames",
        ctx.inspectors().stream().map(Employee::getDisplayName).collect(Collectors.joining(", ")));
    return variables;
  }

  public String subject(ReminderContext ctx) {
    return "Inspection Reminder - " + nullToEmpty(ctx.client().getCompany());
  }

  public String manualEmailBody(ReminderContext ctx, String message) {
    return "Inspection Reminder\n\n"
        + message.strip()
        + "\n\nInspection details:"
        + "\nDate: "
        + formattedDate(ctx)
        + "\nAsset: "
        + ctx.asset().getLabel()
        + "\nLocation: "
        + location(ctx)
        + "\nClient: "
        + nullToEmpty(ctx.client().getCompany());
  }

  /**
   * A manual message is sent as written; short ones get the date and asset appended. Without a
   * manual message the body lists the inspection facts.
   */
  public String smsBody(ReminderContext ctx, String manualMessage) {
    if (manualMessage != null && !manualMessage.isBlank()) {
      String text = manualMessage.strip();
      if (text.length() < shortMessageThreshold) {
        text += "\n\nDate: " + formattedDate(ctx) + "\nAsset: " + ctx.asset().getLabel();
      }
      return text;
    }
    return "Reminder: Inspection scheduled"
        + "\nDate: "
        + formattedDate(ctx)
        + "\nAsset: "
        + ctx.asset().getLabel()
        + "\nLocation: "
        + location(ctx)
        + "\nClient: "
        + nullToEmpty(ctx.client().getCompany());
  }

  private static String formattedDate(ReminderContext ctx) {
    return ctx.inspection().getDueDate().format(DATE_FORMAT);
  }

  private static String location(ReminderContext ctx) {
    String location = ctx.inspection().getLocation();
    if (location == null || location.isBlank()) {
      location = ctx.asset().getLocation();
    }
    return location == null || location.isBlank() ? "Not specified" : location;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
