package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.service.sound.SoundLibrary;
import com.phillippitts.voicecompanion.service.sound.SoundSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Splits sanitized text into speech runs and standalone sound effects.
 *
 * <p>Example with {@code hmph} in the sound library: {@code "a hmph ok"} becomes
 * SPEECH("a"), SOUND("hmph"), SPEECH("ok"). Tokens keep their original spelling inside speech runs.
 */
@Component
public class TextSegmenter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^a-z0-9]+|[^a-z0-9]+$");

    private final SoundLibrary sounds;

    public TextSegmenter(SoundLibrary sounds) {
        this.sounds = sounds;
    }

    /**
     * @param text     sanitized, non-empty text
     * @param sequence source of per-guild sequence ids, called once per produced item
     */
    public List<QueueItem> segment(String text, LongSupplier sequence) {
        List<QueueItem> out = new ArrayList<>();
        List<String> speech = new ArrayList<>();
        for (String token : WHITESPACE.split(text.trim())) {
            if (token.isEmpty()) {
                continue;
            }
            Optional<SoundSource> sound = lookup(token);
            if (sound.isPresent()) {
                flush(speech, out, sequence);
                out.add(QueueItem.sound(sequence.getAsLong(), sound.get()));
            } else {
                speech.add(token);
            }
        }
        flush(speech, out, sequence);
        return out;
    }

    static String normalize(String token) {
        return EDGE_PUNCTUATION.matcher(token.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private Optional<SoundSource> lookup(String token) {
        String key = normalize(token);
        return key.isEmpty() ? Optional.empty() : sounds.resolve(key);
    }

    private static void flush(List<String> speech, List<QueueItem> out, LongSupplier sequence) {
        if (!speech.isEmpty()) {
            out.add(QueueItem.speech(sequence.getAsLong(), String.join(" ", speech)));
            speech.clear();
        }
    }
}
