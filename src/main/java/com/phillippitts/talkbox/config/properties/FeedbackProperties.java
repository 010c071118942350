package com.phillippitts.talkbox.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration for user-facing feedback on rejected or failed requests.
 */
@Validated
@ConfigurationProperties(prefix = "talkbox.feedback")
public class FeedbackProperties {

    /** Minimum time between two identical feedback messages to the same user. */
    @NotNull
    private Duration throttle = Duration.ofSeconds(30);

    public Duration getThrottle() {
        return throttle;
    }

    public void setThrottle(Duration throttle) {
        this.throttle = throttle;
    }
}
