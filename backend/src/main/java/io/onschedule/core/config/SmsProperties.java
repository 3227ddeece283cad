package io.onschedule.core.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * SMS delivery settings.
 *
 * @param provider {@code twilio} or {@code noop}
 * @param interSendDelay pause between consecutive sends
 * @param shortMessageThreshold manual messages shorter than this get the date and asset appended
 */
@ConfigurationProperties(prefix = "onschedule.sms")
public record SmsProperties(
    @DefaultValue("noop") String provider,
    String accountSid,
    String authToken,
    String fromNumber,
    String statusCallbackUrl,
    @DefaultValue("1s") Duration interSendDelay,
    @DefaultValue("120") int shortMessageThreshold) {}
