package com.phillippitts.voicecompanion.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the per-guild settings file ({@code <data-dir>/settings.json}).
 */
@Validated
@ConfigurationProperties(prefix = "voice.settings")
public class SettingsProperties {

    @NotBlank
    private final String dataDir;

    @ConstructorBinding
    public SettingsProperties(String dataDir) {
        this.dataDir = (dataDir == null || dataDir.isBlank()) ? "data" : dataDir;
    }

    public String getDataDir() {
        return dataDir;
    }
}
