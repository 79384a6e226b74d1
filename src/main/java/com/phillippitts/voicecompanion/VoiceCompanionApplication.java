package com.phillippitts.voicecompanion;

import com.phillippitts.voicecompanion.config.properties.FollowProperties;
import com.phillippitts.voicecompanion.config.properties.PlaybackProperties;
import com.phillippitts.voicecompanion.config.properties.SettingsProperties;
import com.phillippitts.voicecompanion.config.properties.TtsProperties;
import com.phillippitts.voicecompanion.config.properties.VoiceConnectionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        VoiceConnectionProperties.class,
        PlaybackProperties.class,
        FollowProperties.class,
        SettingsProperties.class,
        TtsProperties.class
})
@EnableScheduling
public class VoiceCompanionApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceCompanionApplication.class, args);
    }

}
