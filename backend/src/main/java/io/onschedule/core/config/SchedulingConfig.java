package io.onschedule.core.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties({ReminderProperties.class, SchedulerProperties.class})
public class SchedulingConfig {

  @Bean
  Clock clock(ReminderProperties reminderProperties) {
    return Clock.system(reminderProperties.zone());
  }

  /**
   * Runs reminder job timers and the {@code @Scheduled} recurrence sweep. Delays are measured
   * against the application clock.
   */
  @Bean
  TaskScheduler taskScheduler(SchedulerProperties schedulerProperties, Clock clock) {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setClock(clock);
    scheduler.setPoolSize(schedulerProperties.poolSize());
    scheduler.setThreadNamePrefix("reminder-job-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    scheduler.initialize();
    return scheduler;
  }

  /** Fans out the sends of one email batch. */
  @Bean
  ThreadPoolTaskExecutor notificationExecutor(SchedulerProperties schedulerProperties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(schedulerProperties.notificationPoolSize());
    executor.setMaxPoolSize(schedulerProperties.notificationPoolSize());
    executor.setThreadNamePrefix("notification-");
    executor.initialize();
    return executor;
  }
}
