package com.phillippitts.voicecompanion.service.settings;

import com.phillippitts.voicecompanion.config.properties.SettingsProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Guild settings in {@code <data-dir>/settings.json}:
 * <pre>
 * { "123456789012345678": { "mode247Enabled": true } }
 * </pre>
 *
 * <p>Reads go to disk every time so manual edits are picked up. Writes are read-modify-write under
 * a lock and replace the file atomically. A missing or unparseable file reads as empty settings.
 */
@Component
public class JsonFileGuildSettingsStore implements GuildSettingsStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileGuildSettingsStore.class);

    static final String FILE_NAME = "settings.json";
    static final String PERSISTENT_MODE_KEY = "mode247Enabled";

    private final Path dataDir;
    private final Path file;
    private final ReentrantLock writeLock = new ReentrantLock();

    @Autowired
    public JsonFileGuildSettingsStore(SettingsProperties props) {
        this(Paths.get(props.getDataDir()));
    }

    public JsonFileGuildSettingsStore(Path dataDir) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.file = this.dataDir.resolve(FILE_NAME);
        LOG.info("Guild settings file: {}", file);
    }

    @Override
    public boolean isPersistentMode(String guildId) {
        JSONObject guild = readAll().optJSONObject(guildId);
        return guild != null && guild.optBoolean(PERSISTENT_MODE_KEY, false);
    }

    @Override
    public void setPersistentMode(String guildId, boolean enabled) {
        writeLock.lock();
        try {
            JSONObject all = readAll();
            JSONObject guild = all.optJSONObject(guildId);
            if (guild == null) {
                guild = new JSONObject();
                all.put(guildId, guild);
            }
            guild.put(PERSISTENT_MODE_KEY, enabled);
            writeAll(all);
        } finally {
            writeLock.unlock();
        }
        LOG.info("Persistent mode {} for guild {}", enabled ? "enabled" : "disabled", guildId);
    }

    private JSONObject readAll() {
        if (!Files.isRegularFile(file)) {
            return new JSONObject();
        }
        try {
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            return raw.isBlank() ? new JSONObject() : new JSONObject(raw);
        } catch (IOException | JSONException e) {
            LOG.warn("Could not read {}; treating settings as empty: {}", file, e.getMessage());
            return new JSONObject();
        }
    }

    private void writeAll(JSONObject all) {
        try {
            Files.createDirectories(dataDir);
            Path tmp = Files.createTempFile(dataDir, FILE_NAME, ".tmp");
            Files.writeString(tmp, all.toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
