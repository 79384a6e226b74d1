package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.exception.ResourceBuildException;
import com.phillippitts.voicecompanion.service.voice.transport.AudioResource;

/**
 * Builds a playable resource from encoded audio bytes.
 */
public interface AudioResourceFactory {

    /**
     * @throws ResourceBuildException for empty or unrecognized payloads
     */
    AudioResource create(String name, byte[] data);
}
