package com.phillippitts.talkbox.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration properties for the pending-work queue.
 *
 * <p>Example:
 * <pre>
 * talkbox.queue.max-size=50
 * talkbox.queue.admin-ids=1234567890,9876543210
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "talkbox.queue")
public class QueueProperties {

    /** Maximum number of pending items. Admin items may evict normal ones but never exceed this. */
    @Min(value = 1, message = "Queue max-size must be at least 1")
    @Max(value = 10_000, message = "Queue max-size must not exceed 10000")
    private int maxSize = 50;

    /** User ids whose events are queued with admin priority and may issue admin commands. */
    @NotNull
    private Set<String> adminIds = new LinkedHashSet<>();

    public int getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(int maxSize) {
        this.maxSize = maxSize;
    }

    public Set<String> getAdminIds() {
        return adminIds;
    }

    public void setAdminIds(Set<String> adminIds) {
        this.adminIds = adminIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(adminIds);
    }
}
