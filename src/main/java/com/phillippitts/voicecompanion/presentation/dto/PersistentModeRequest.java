package com.phillippitts.voicecompanion.presentation.dto;

/**
 * @param enabled new value; null toggles the current one
 */
public record PersistentModeRequest(Boolean enabled) {
}
