package io.onschedule.core.notification;

import java.util.List;

public record BatchSummary(int success, int failed, int total, List<NotificationResult> results) {

  public static BatchSummary of(List<NotificationResult> results) {
    int ok = (int) results.stream().filter(NotificationResult::success).count();
    return new BatchSummary(ok, results.size() - ok, results.size(), List.copyOf(results));
  }

  public static BatchSummary empty() {
    return new BatchSummary(0, 0, 0, List.of());
  }
}
