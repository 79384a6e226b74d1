package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.service.sound.SoundSource;

import java.util.Objects;

/**
 * One unit of playback: a speech segment or a sound effect.
 *
 * @param sequenceId per-guild, strictly increasing in enqueue order
 * @param text       text to speak (SPEECH) or the sound key (SOUND)
 * @param sound      resolved sound file, present only for SOUND
 */
public record QueueItem(long sequenceId, Kind kind, String text, SoundSource sound) {

    public enum Kind { SPEECH, SOUND }

    public QueueItem {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if ((kind == Kind.SOUND) != (sound != null)) {
            throw new IllegalArgumentException("sound must be present only for SOUND items");
        }
    }

    public static QueueItem speech(long sequenceId, String text) {
        return new QueueItem(sequenceId, Kind.SPEECH, text, null);
    }

    public static QueueItem sound(long sequenceId, SoundSource sound) {
        return new QueueItem(sequenceId, Kind.SOUND, sound.key(), sound);
    }

    String metricKind() {
        return kind == Kind.SPEECH ? "speech" : "sound";
    }
}
