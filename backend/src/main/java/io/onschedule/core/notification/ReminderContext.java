package io.onschedule.core.notification;

import io.onschedule.core.asset.Asset;
import io.onschedule.core.client.Client;
import io.onschedule.core.employee.Employee;
import io.onschedule.core.inspection.Inspection;
import io.onschedule.core.reminder.Reminder;
import io.onschedule.core.template.EmailTemplate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Everything needed to send one reminder, loaded up front so no provider call runs inside a
 * transaction. {@code emailTemplate} is null in manual mode or when the reminder has no email
 * template.
 */
public record ReminderContext(
    Inspection inspection,
    Client client,
    Asset asset,
    List<Employee> inspectors,
    Reminder reminder,
    EmailTemplate emailTemplate) {

  /** Client then inspector addresses, trimmed, blanks dropped, first occurrence kept. */
  public List<String> emailRecipients() {
    return recipients(Client::getEmail, Employee::getEmail);
  }

  public List<String> phoneRecipients() {
    return recipients(Client::getPhone, Employee::getPhone);
  }

  private List<String> recipients(
      Function<Client, String> clientField, Function<Employee, String> employeeField) {
    Set<String> result = new LinkedHashSet<>();
    addIfPresent(result, clientField.apply(client));
    for (Employee inspector : inspectors) {
      addIfPresent(result, employeeField.apply(inspector));
    }
    return List.copyOf(result);
  }

  private static void addIfPresent(Set<String> target, String value) {
    if (value != null && !value.isBlank()) {
      target.add(value.strip());
    }
  }
}
