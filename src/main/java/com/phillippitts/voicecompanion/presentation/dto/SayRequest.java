package com.phillippitts.voicecompanion.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param channelId voice channel the owner is in
 * @param text      raw text; sanitization may still reduce it to nothing
 */
public record SayRequest(@NotBlank String channelId, @NotNull String text) {
}
