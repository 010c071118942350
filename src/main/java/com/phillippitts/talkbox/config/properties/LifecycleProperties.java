package com.phillippitts.talkbox.config.properties;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for ordered startup and shutdown.
 */
@Validated
@ConfigurationProperties(prefix = "talkbox.lifecycle")
public class LifecycleProperties {

    /**
     * How long shutdown waits for background tasks to exit on their own (letting the pipeline finish
     * the item it is playing) before interrupting them.
     */
    private final Duration shutdownGrace;

    /** Whether the idle animation loop runs while the avatar is connected. */
    private final boolean animationEnabled;

    /** Delay between idle animation ticks. 16ms is roughly 60 frames per second. */
    private final Duration animationFrameInterval;

    @ConstructorBinding
    public LifecycleProperties(Duration shutdownGrace, Boolean animationEnabled, Duration animationFrameInterval) {
        this.shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(10) : shutdownGrace;
        this.animationEnabled = animationEnabled == null || animationEnabled;
        this.animationFrameInterval = animationFrameInterval == null
                ? Duration.ofMillis(16) : animationFrameInterval;
    }

    /** Defaults for tests. */
    public LifecycleProperties() {
        this(null, null, null);
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public boolean isAnimationEnabled() {
        return animationEnabled;
    }

    public Duration getAnimationFrameInterval() {
        return animationFrameInterval;
    }

    @AssertTrue(message = "Lifecycle durations must be positive")
    boolean isDurationsValid() {
        return !shutdownGrace.isNegative() && !shutdownGrace.isZero()
                && !animationFrameInterval.isNegative() && !animationFrameInterval.isZero();
    }
}
