package com.phillippitts.voicecompanion.config;

import com.phillippitts.voicecompanion.service.voice.transport.UnavailableVoiceTransport;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link UnavailableVoiceTransport} when no gateway adapter bean is present.
 */
@Configuration
public class VoiceTransportConfig {

    private static final Logger LOG = LogManager.getLogger(VoiceTransportConfig.class);

    @Bean
    @ConditionalOnMissingBean(VoiceTransport.class)
    public VoiceTransport unavailableVoiceTransport() {
        LOG.warn("No VoiceTransport adapter found; voice connects will be rejected");
        return new UnavailableVoiceTransport();
    }
}
