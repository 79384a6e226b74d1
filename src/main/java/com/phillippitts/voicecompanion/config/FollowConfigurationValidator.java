package com.phillippitts.voicecompanion.config;

import com.phillippitts.voicecompanion.config.properties.FollowProperties;
import com.phillippitts.voicecompanion.config.properties.VoiceConnectionProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates owner identity and timing bounds at startup to fail fast with actionable messages.
 */
@Component
class FollowConfigurationValidator {

    private static final Pattern SNOWFLAKE = Pattern.compile("\\d{5,25}");

    private final FollowProperties follow;
    private final VoiceConnectionProperties connection;

    FollowConfigurationValidator(FollowProperties follow, VoiceConnectionProperties connection) {
        this.follow = follow;
        this.connection = connection;
    }

    @PostConstruct
    void validate() {
        if (!SNOWFLAKE.matcher(follow.getOwnerId()).matches()) {
            throw new IllegalArgumentException("Invalid voice.follow.owner-id: '" + follow.getOwnerId()
                    + "'. Must be the owner's numeric user id.");
        }
        if (connection.getBackoffMaxMs() < connection.getBackoffBaseMs()) {
            throw new IllegalArgumentException("voice.connection.backoff-max-ms ("
                    + connection.getBackoffMaxMs() + ") must be >= backoff-base-ms ("
                    + connection.getBackoffBaseMs() + ")");
        }
        if (follow.getDebounceDelayMs() > 10_000) {
            throw new IllegalArgumentException(
                    "voice.follow.debounce-delay-ms must be at most 10000, got: " + follow.getDebounceDelayMs());
        }
    }
}
