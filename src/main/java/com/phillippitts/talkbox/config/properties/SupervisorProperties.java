package com.phillippitts.talkbox.config.properties;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for connection supervisors wrapping interactive adapters.
 */
@Validated
@ConfigurationProperties(prefix = "talkbox.supervisor")
public class SupervisorProperties {

    /** Fixed delay between reconnect attempts after a failure. Not adaptive. */
    private Duration backoffInterval = Duration.ofSeconds(3);

    public Duration getBackoffInterval() {
        return backoffInterval;
    }

    public void setBackoffInterval(Duration backoffInterval) {
        this.backoffInterval = backoffInterval;
    }

    @AssertTrue(message = "Supervisor backoff-interval must be positive")
    boolean isBackoffIntervalPositive() {
        return backoffInterval != null && !backoffInterval.isNegative() && !backoffInterval.isZero();
    }
}
