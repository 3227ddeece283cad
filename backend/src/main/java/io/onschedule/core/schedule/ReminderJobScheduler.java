package io.onschedule.core.schedule;

import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * In-memory registry of one-shot reminder jobs keyed by {@link JobId}. Jobs run on the shared
 * {@link TaskScheduler}; the registry does not survive a restart (see {@link
 * ReminderJobReloader}).
 */
@Component
public class ReminderJobScheduler {

  private static final Logger log = LoggerFactory.getLogger(ReminderJobScheduler.class);

  private final TaskScheduler taskScheduler;
  private final Map<JobId, ScheduledJob> jobs = new ConcurrentHashMap<>();

  public ReminderJobScheduler(TaskScheduler taskScheduler) {
    this.taskScheduler = taskScheduler;
  }

  /**
   * Registers {@code callback} to run once at {@code fireAt}. An existing job with the same id is
   * cancelled first. Exceptions thrown by the callback are logged and never reach the caller.
   */
  public synchronized void scheduleJob(JobId id, Instant fireAt, Runnable callback) {
    var previous = jobs.remove(id);
    if (previous != null) {
      previous.cancel();
      log.debug("Replaced reminder job {} (was {}, now {})", id, previous.fireAt(), fireAt);
    }
    var job = new ScheduledJob(id, fireAt);
    jobs.put(id, job);
    job.future = taskScheduler.schedule(() -> fire(job, callback), fireAt);
    log.debug("Scheduled reminder job {} at {}", id, fireAt);
  }

  /** Cancels and forgets the job; unknown ids are ignored. */
  public synchronized boolean cancelJob(JobId id) {
    var job = jobs.remove(id);
    if (job == null) {
      return false;
    }
    job.cancel();
    log.debug("Cancelled reminder job {}", id);
    return true;
  }

  public boolean isScheduled(JobId id) {
    return jobs.containsKey(id);
  }

  public int pendingCount() {
    return jobs.size();
  }

  /** Snapshot of pending jobs and their fire times, ordered by key. */
  public Map<String, Instant> pendingJobs() {
    var snapshot = new TreeMap<String, Instant>();
    jobs.forEach((id, job) -> snapshot.put(id.key(), job.fireAt()));
    return snapshot;
  }

  @PreDestroy
  public synchronized void cancelAll() {
    if (!jobs.isEmpty()) {
      log.info("Cancelling {} pending reminder job(s) on shutdown", jobs.size());
    }
    jobs.values().forEach(ScheduledJob::cancel);
    jobs.clear();
  }

  private void fire(ScheduledJob job, Runnable callback) {
    try {
      log.info("Running reminder job {}", job.id());
      callback.run();
    } catch (Exception e) {
      log.error("Scheduling error in reminder job {}: {}", job.id(), e.getMessage(), e);
    } finally {
      synchronized (this) {
        jobs.remove(job.id(), job);
      }
    }
  }

  private static final class ScheduledJob {
    private final JobId id;
    private final Instant fireAt;
    private volatile ScheduledFuture<?> future;

    private ScheduledJob(JobId id, Instant fireAt) {
      this.id = id;
      this.fireAt = fireAt;
    }

    JobId id() {
      return id;
    }

    Instant fireAt() {
      return fireAt;
    }

    void cancel() {
      var f = future;
      if (f != null) {
        f.cancel(false);
      }
    }
  }
}
