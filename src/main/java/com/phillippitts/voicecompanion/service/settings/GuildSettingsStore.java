package com.phillippitts.voicecompanion.service.settings;

/**
 * Durable per-guild flags.
 */
public interface GuildSettingsStore {

    /**
     * Persistent ("24/7") mode keeps the bot connected when the owner leaves.
     */
    boolean isPersistentMode(String guildId);

    void setPersistentMode(String guildId, boolean enabled);

}
