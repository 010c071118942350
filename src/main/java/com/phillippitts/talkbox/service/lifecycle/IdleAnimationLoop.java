package com.phillippitts.talkbox.service.lifecycle;

import com.phillippitts.talkbox.service.avatar.AvatarController;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Ticks the avatar's idle animation at a fixed frame interval until the stop signal trips.
 *
 * <p>Tick failures never end the loop. The first failure in a run of failures is logged at WARN,
 * the rest at DEBUG.
 */
public class IdleAnimationLoop {

    private static final Logger LOG = LogManager.getLogger(IdleAnimationLoop.class);

    private final AvatarController avatar;
    private final Duration frameInterval;
    private final StopSignal stopSignal;

    private long ticks;
    private int consecutiveFailures;

    public IdleAnimationLoop(AvatarController avatar, Duration frameInterval, StopSignal stopSignal) {
        this.avatar = Objects.requireNonNull(avatar, "avatar");
        this.frameInterval = Objects.requireNonNull(frameInterval, "frameInterval");
        this.stopSignal = Objects.requireNonNull(stopSignal, "stopSignal");
    }

    public void run() {
        LOG.info("Idle animation started ({}ms per frame)", frameInterval.toMillis());
        try {
            while (!stopSignal.isStopped()) {
                tick();
                if (stopSignal.await(frameInterval)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Idle animation stopped after {} frame(s)", ticks);
    }

    private void tick() {
        try {
            avatar.idleTick();
            ticks++;
            consecutiveFailures = 0;
        } catch (RuntimeException e) {
            if (consecutiveFailures++ == 0) {
                LOG.warn("Idle animation tick failed: {}", e.toString());
            } else {
                LOG.debug("Idle animation tick failed ({} in a row): {}", consecutiveFailures, e.toString());
            }
        }
    }
}
