package com.phillippitts.voicecompanion.service.tts;

import com.phillippitts.voicecompanion.config.properties.TtsProperties;
import com.phillippitts.voicecompanion.exception.SynthesisException;
import com.phillippitts.voicecompanion.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Speech synthesis through the public translate TTS endpoint (MP3 output).
 *
 * <p>Each call makes up to {@code 1 + tts.retries} HTTP requests. Successful results are kept in
 * a FIFO cache keyed by {@code lang:text} holding at most {@code tts.cache-max-entries} entries.
 */
@Component
public class GttsAudioSynthesizer implements AudioSynthesizer {

    private static final Logger LOG = LogManager.getLogger(GttsAudioSynthesizer.class);

    static final String PROVIDER = "gtts";
    private static final String ACCEPT = "audio/mpeg,audio/*;q=0.9,*/*;q=0.8";
    private static final String USER_AGENT = "Mozilla/5.0";

    private final RestClient client;
    private final TtsProperties props;
    private final Map<String, byte[]> cache;

    public GttsAudioSynthesizer(@Qualifier("ttsRestClient") RestClient client, TtsProperties props) {
        this.client = Objects.requireNonNull(client, "client");
        this.props = Objects.requireNonNull(props, "props");
        int maxEntries = props.getCacheMaxEntries();
        this.cache = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, byte[]> eldest) {
                return size() > maxEntries;
            }
        };
        LOG.info("gTTS synthesizer initialized: lang={}, timeoutMs={}, retries={}, cacheMaxEntries={}",
                props.getLang(), props.getTimeoutMs(), props.getRetries(), maxEntries);
    }

    @Override
    public byte[] synthesize(String text) {
        if (text == null || text.isBlank()) {
            throw new SynthesisException("Nothing to synthesize", PROVIDER);
        }
        String key = props.getLang() + ":" + text;
        byte[] cached = cacheGet(key);
        if (cached != null) {
            return cached.clone();
        }

        RuntimeException last = null;
        for (int attempt = 0; attempt <= props.getRetries(); attempt++) {
            try {
                byte[] audio = fetch(text);
                cachePut(key, audio.clone());
                return audio;
            } catch (RestClientException | SynthesisException e) {
                last = e;
                LOG.warn("gTTS attempt {} failed for '{}': {}", attempt, LogSanitizer.preview(text), e.getMessage());
            }
        }
        if (last instanceof SynthesisException se) {
            throw se;
        }
        throw new SynthesisException("gTTS request failed", PROVIDER, last);
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    private byte[] fetch(String text) {
        byte[] body = client.get()
                .uri(props.getEndpoint() + "?ie=UTF-8&q={q}&tl={tl}&client=tw-ob", text, props.getLang())
                .header(HttpHeaders.USER_AGENT, USER_AGENT)
                .header(HttpHeaders.ACCEPT, ACCEPT)
                .retrieve()
                .body(byte[].class);
        if (body == null || body.length == 0) {
            throw new SynthesisException("gTTS returned an empty body", PROVIDER);
        }
        return body;
    }

    private byte[] cacheGet(String key) {
        synchronized (cache) {
            return cache.get(key);
        }
    }

    private void cachePut(String key, byte[] audio) {
        if (props.getCacheMaxEntries() == 0) {
            return;
        }
        synchronized (cache) {
            cache.put(key, audio);
        }
    }

    int cacheSize() {
        synchronized (cache) {
            return cache.size();
        }
    }
}
