package com.phillippitts.voicecompanion.service.voice.transport;

import java.util.Objects;

/**
 * Identifies a voice channel within a guild.
 */
public record VoiceChannel(String guildId, String channelId) {

    public VoiceChannel {
        Objects.requireNonNull(guildId, "guildId");
        Objects.requireNonNull(channelId, "channelId");
        if (guildId.isBlank() || channelId.isBlank()) {
            throw new IllegalArgumentException("guildId and channelId must not be blank");
        }
    }
}
