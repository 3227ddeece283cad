package io.onschedule.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param poolSize threads available to reminder job timers and the recurrence sweep
 * @param notificationPoolSize threads used to fan out one email batch concurrently
 */
@ConfigurationProperties(prefix = "onschedule.scheduler")
public record SchedulerProperties(
    @DefaultValue("2") int poolSize, @DefaultValue("8") int notificationPoolSize) {}
