package com.phillippitts.voicecompanion.service.voice;

/**
 * Read-only diagnostic view of one guild session.
 */
public record VoiceSessionStatus(String guildId,
                                 VoiceState state,
                                 String channelId,
                                 int retries,
                                 String lastError) {
}
