package com.phillippitts.voicecompanion.config;

import com.phillippitts.voicecompanion.service.tts.AudioSynthesizer;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceTransport;
import com.phillippitts.voicecompanion.testutil.FakeSynthesizer;
import com.phillippitts.voicecompanion.testutil.FakeVoiceTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Test doubles for the outside world: the voice gateway and the speech synthesizer.
 *
 * <p><b>Usage:</b>
 * <pre>
 * {@literal @}SpringBootTest
 * {@literal @}Import(IntegrationTestConfiguration.class)
 * class MyIntegrationTest { ... }
 * </pre>
 *
 * <p>Both beans are {@code @Primary} so they win over the production beans whether or not those
 * are also registered.
 */
@Configuration
public class IntegrationTestConfiguration {

    @Bean
    @Primary
    public FakeVoiceTransport fakeVoiceTransport() {
        return new FakeVoiceTransport();
    }

    @Bean
    @Primary
    public AudioSynthesizer fakeSynthesizer() {
        return new FakeSynthesizer();
    }
}
