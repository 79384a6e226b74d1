package com.phillippitts.voicecompanion.service.follow;

import java.util.Objects;

/**
 * A user's voice channel changed (or another voice attribute changed while the channel stayed).
 *
 * @param beforeChannelId channel before the update, null when not in voice
 * @param afterChannelId  channel after the update, null when not in voice
 */
public record VoicePresenceUpdate(String guildId, String userId, String beforeChannelId, String afterChannelId) {

    public VoicePresenceUpdate {
        Objects.requireNonNull(guildId, "guildId");
        Objects.requireNonNull(userId, "userId");
    }

    /**
     * Folds a burst: keeps the first "before" and takes the latest "after".
     */
    static VoicePresenceUpdate coalesce(VoicePresenceUpdate first, VoicePresenceUpdate latest) {
        return new VoicePresenceUpdate(first.guildId(), first.userId(), first.beforeChannelId(),
                latest.afterChannelId());
    }
}
