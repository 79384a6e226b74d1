package com.phillippitts.voicecompanion.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Owner identity and debounce windows for presence following and chat auto-reading.
 */
@Validated
@ConfigurationProperties(prefix = "voice.follow")
public class FollowProperties {

    /** Platform user id of the single owner this service follows. */
    @NotBlank
    private final String ownerId;

    @Min(0)
    private final long debounceDelayMs;

    @Min(0)
    private final long autoReadDebounceMs;

    @ConstructorBinding
    public FollowProperties(String ownerId, Long debounceDelayMs, Long autoReadDebounceMs) {
        this.ownerId = ownerId == null ? "" : ownerId.trim();
        this.debounceDelayMs = debounceDelayMs == null ? 500L : debounceDelayMs;
        this.autoReadDebounceMs = autoReadDebounceMs == null ? 300L : autoReadDebounceMs;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public long getDebounceDelayMs() {
        return debounceDelayMs;
    }

    public long getAutoReadDebounceMs() {
        return autoReadDebounceMs;
    }

    public boolean isOwner(String userId) {
        return userId != null && ownerId.equals(userId.trim());
    }
}
