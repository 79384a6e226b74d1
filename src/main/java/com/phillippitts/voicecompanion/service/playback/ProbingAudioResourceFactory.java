package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.exception.ResourceBuildException;
import com.phillippitts.voicecompanion.service.voice.transport.AudioContainer;
import com.phillippitts.voicecompanion.service.voice.transport.AudioResource;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Detects the container from magic bytes.
 *
 * <ul>
 *   <li>{@code RIFF....WAVE} - WAV</li>
 *   <li>{@code ID3} tag or MPEG frame sync ({@code 0xFFE}) - MP3</li>
 *   <li>{@code OggS} - OGG (Vorbis or Opus)</li>
 * </ul>
 */
@Component
public class ProbingAudioResourceFactory implements AudioResourceFactory {

    @Override
    public AudioResource create(String name, byte[] data) {
        if (data == null || data.length == 0) {
            throw new ResourceBuildException(name, "no audio data");
        }
        AudioContainer container = probe(data);
        if (container == null) {
            throw new ResourceBuildException(name, "unrecognized audio container");
        }
        return new AudioResource(name, container, data);
    }

    static AudioContainer probe(byte[] data) {
        if (data.length >= 12 && ascii(data, 0, "RIFF") && ascii(data, 8, "WAVE")) {
            return AudioContainer.WAV;
        }
        if (data.length >= 4 && ascii(data, 0, "OggS")) {
            return AudioContainer.OGG;
        }
        if (data.length >= 3 && ascii(data, 0, "ID3")) {
            return AudioContainer.MP3;
        }
        if (data.length >= 2 && (data[0] & 0xFF) == 0xFF && (data[1] & 0xE0) == 0xE0) {
            return AudioContainer.MP3;
        }
        return null;
    }

    private static boolean ascii(byte[] data, int offset, String magic) {
        byte[] expected = magic.getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < expected.length; i++) {
            if (data[offset + i] != expected[i]) {
                return false;
            }
        }
        return true;
    }
}
