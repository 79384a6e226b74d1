package com.phillippitts.voicecompanion.service.playback;

import com.phillippitts.voicecompanion.service.sound.SoundLibrary;
import com.phillippitts.voicecompanion.service.sound.SoundSource;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class TextSegmenterTest {

    private static final Set<String> KNOWN = Set.of("hmph", "bruh");

    private final SoundLibrary sounds = key -> KNOWN.contains(key)
            ? Optional.of(new SoundSource(key, Path.of("sounds", key + ".mp3")))
            : Optional.empty();
    private final TextSegmenter segmenter = new TextSegmenter(sounds);
    private final AtomicLong sequence = new AtomicLong();

    @Test
    void speechOnlyTextIsOneItem() {
        List<QueueItem> items = segmenter.segment("hola que tal", sequence::incrementAndGet);

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.kind()).isEqualTo(QueueItem.Kind.SPEECH);
            assertThat(item.text()).isEqualTo("hola que tal");
        });
    }

    @Test
    void soundTokensSplitSpeechRuns() {
        List<QueueItem> items = segmenter.segment("a hmph ok", sequence::incrementAndGet);

        assertThat(items).extracting(QueueItem::kind)
                .containsExactly(QueueItem.Kind.SPEECH, QueueItem.Kind.SOUND, QueueItem.Kind.SPEECH);
        assertThat(items).extracting(QueueItem::text).containsExactly("a", "hmph", "ok");
        assertThat(items).extracting(QueueItem::sequenceId).containsExactly(1L, 2L, 3L);
    }

    @Test
    void matchesIgnoringCaseAndEdgePunctuation() {
        List<QueueItem> items = segmenter.segment("HMPH! bruh...", sequence::incrementAndGet);

        assertThat(items).extracting(QueueItem::kind)
                .containsExactly(QueueItem.Kind.SOUND, QueueItem.Kind.SOUND);
        assertThat(items.get(0).sound().fileName()).isEqualTo("hmph.mp3");
    }

    @Test
    void speechKeepsOriginalSpelling() {
        List<QueueItem> items = segmenter.segment("Hola, AMIGO hmph", sequence::incrementAndGet);

        assertThat(items.get(0).text()).isEqualTo("Hola, AMIGO");
    }

    @Test
    void normalizeStripsPunctuationAtEdgesOnly() {
        assertThat(TextSegmenter.normalize("¡Hmph!")).isEqualTo("hmph");
        assertThat(TextSegmenter.normalize("so-so")).isEqualTo("so-so");
        assertThat(TextSegmenter.normalize("...")).isEmpty();
    }
}
