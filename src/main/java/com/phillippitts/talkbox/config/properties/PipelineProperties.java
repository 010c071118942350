package com.phillippitts.talkbox.config.properties;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the response pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "talkbox.pipeline")
public class PipelineProperties {

    /**
     * Items that waited longer than this before being dequeued are skipped without calling any
     * collaborator. Zero disables the check.
     */
    private final Duration maxItemAge;

    @ConstructorBinding
    public PipelineProperties(Duration maxItemAge) {
        this.maxItemAge = maxItemAge == null ? Duration.ZERO : maxItemAge;
    }

    /** Defaults: no staleness limit. */
    public PipelineProperties() {
        this(Duration.ZERO);
    }

    public Duration getMaxItemAge() {
        return maxItemAge;
    }

    public boolean isStalenessCheckEnabled() {
        return !maxItemAge.isZero();
    }

    @AssertTrue(message = "Pipeline max-item-age must not be negative")
    boolean isMaxItemAgeValid() {
        return !maxItemAge.isNegative();
    }
}
