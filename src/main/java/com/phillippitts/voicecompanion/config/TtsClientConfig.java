package com.phillippitts.voicecompanion.config;

import com.phillippitts.voicecompanion.config.properties.TtsProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used by the speech synthesizer, with connect and read bounded by {@code tts.timeout-ms}.
 */
@Configuration
public class TtsClientConfig {

    @Bean(name = "ttsRestClient")
    public RestClient ttsRestClient(RestClient.Builder builder, TtsProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getTimeoutMs());
        requestFactory.setReadTimeout(props.getTimeoutMs());
        return builder.requestFactory(requestFactory).build();
    }
}
