package com.phillippitts.voicecompanion.presentation.dto;

import java.time.Instant;

public record RecentAudioResponse(String name, int sizeBytes, Instant playedAt) {
}
