package com.phillippitts.voicecompanion.presentation.dto;

public record PersistentModeResponse(String guildId, boolean enabled) {
}
