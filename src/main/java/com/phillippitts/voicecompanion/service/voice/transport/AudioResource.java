package com.phillippitts.voicecompanion.service.voice.transport;

import java.util.Objects;

/**
 * Playable audio: raw bytes plus the detected container.
 *
 * @param name     display name (sound key or text preview), used in logs and history
 * @param container detected container format
 * @param data     encoded audio bytes
 */
public record AudioResource(String name, AudioContainer container, byte[] data) {

    public AudioResource {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(data, "data");
    }

    @Override
    public String toString() {
        return "AudioResource[name=" + name + ", container=" + container + ", bytes=" + data.length + "]";
    }
}
