package com.phillippitts.voicecompanion.service.sound;

import java.util.Optional;

/**
 * Pure lookup from a normalized token to a sound effect.
 */
public interface SoundLibrary {

    /**
     * @param key lowercase token with edge punctuation removed
     * @return the sound for this key, or empty when none exists
     */
    Optional<SoundSource> resolve(String key);
}
