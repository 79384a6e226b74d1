package com.phillippitts.voicecompanion.service.tts;

import com.phillippitts.voicecompanion.exception.SynthesisException;

/**
 * Turns text into encoded audio bytes.
 */
public interface AudioSynthesizer {

    /**
     * @param text sanitized, non-empty text
     * @return encoded audio (container detected downstream)
     * @throws SynthesisException when no audio could be produced
     */
    byte[] synthesize(String text);

    /** Short provider name used in logs and error messages. */
    String name();
}
