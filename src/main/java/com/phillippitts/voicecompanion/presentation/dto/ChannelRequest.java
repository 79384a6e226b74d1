package com.phillippitts.voicecompanion.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record ChannelRequest(@NotBlank String channelId) {
}
