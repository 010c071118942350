package com.phillippitts.talkbox.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the default Java Sound playback sink.
 */
@Validated
@ConfigurationProperties(prefix = "talkbox.playback")
public class PlaybackProperties {

    /** Register the Java Sound sink when no other PlaybackSink bean exists. */
    private boolean enabled = true;

    /** Optional mixer name; the system default output is used when blank. */
    private String deviceName;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public void setDeviceName(String deviceName) {
        this.deviceName = deviceName;
    }
}
