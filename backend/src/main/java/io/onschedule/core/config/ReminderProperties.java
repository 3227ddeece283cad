package io.onschedule.core.config;

import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Reminder timing settings.
 *
 * @param sendTime wall-clock time of day at which reminder jobs fire
 * @param zone zone in which {@code sendTime} is interpreted
 * @param reloadOnStartup whether future reminder jobs are re-registered when the application starts
 */
@ConfigurationProperties(prefix = "onschedule.reminders")
public record ReminderProperties(
    @DefaultValue("09:00") LocalTime sendTime,
    @DefaultValue("UTC") ZoneId zone,
    @DefaultValue("true") boolean reloadOnStartup) {}
