package com.phillippitts.voicecompanion.service.sound;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A resolved sound effect: lookup key plus the file that holds it.
 */
public record SoundSource(String key, Path file) {

    public SoundSource {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(file, "file");
    }

    /** File name including extension, e.g. {@code hmph.wav}. */
    public String fileName() {
        return file.getFileName().toString();
    }

    public byte[] readBytes() throws IOException {
        return Files.readAllBytes(file);
    }
}
