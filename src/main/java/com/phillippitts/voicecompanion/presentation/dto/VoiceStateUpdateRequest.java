package com.phillippitts.voicecompanion.presentation.dto;

import com.phillippitts.voicecompanion.service.follow.VoicePresenceUpdate;
import jakarta.validation.constraints.NotBlank;

/**
 * Raw presence change as delivered by the gateway adapter.
 */
public record VoiceStateUpdateRequest(@NotBlank String guildId,
                                      @NotBlank String userId,
                                      String beforeChannelId,
                                      String afterChannelId) {

    public VoicePresenceUpdate toUpdate() {
        return new VoicePresenceUpdate(guildId, userId, blankToNull(beforeChannelId), blankToNull(afterChannelId));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
