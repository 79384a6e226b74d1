package com.phillippitts.voicecompanion.service.settings;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileGuildSettingsStoreTest {

    @TempDir
    Path dataDir;

    @Test
    void defaultsToDisabled() {
        JsonFileGuildSettingsStore store = new JsonFileGuildSettingsStore(dataDir);

        assertThat(store.isPersistentMode("123")).isFalse();
    }

    @Test
    void persistsAcrossInstances() {
        new JsonFileGuildSettingsStore(dataDir).setPersistentMode("123", true);

        JsonFileGuildSettingsStore reopened = new JsonFileGuildSettingsStore(dataDir);

        assertThat(reopened.isPersistentMode("123")).isTrue();
        assertThat(reopened.isPersistentMode("456")).isFalse();
    }

    @Test
    void writesDocumentedFileLayout() throws IOException {
        JsonFileGuildSettingsStore store = new JsonFileGuildSettingsStore(dataDir);
        store.setPersistentMode("123", true);
        store.setPersistentMode("456", false);

        JSONObject json = new JSONObject(Files.readString(dataDir.resolve("settings.json"), StandardCharsets.UTF_8));

        assertThat(json.getJSONObject("123").getBoolean("mode247Enabled")).isTrue();
        assertThat(json.getJSONObject("456").getBoolean("mode247Enabled")).isFalse();
    }

    @Test
    void preservesUnknownKeysOnUpdate() throws IOException {
        Files.writeString(dataDir.resolve("settings.json"),
                "{\"123\": {\"mode247Enabled\": false, \"volume\": 7}}", StandardCharsets.UTF_8);
        JsonFileGuildSettingsStore store = new JsonFileGuildSettingsStore(dataDir);

        store.setPersistentMode("123", true);

        JSONObject json = new JSONObject(Files.readString(dataDir.resolve("settings.json"), StandardCharsets.UTF_8));
        assertThat(json.getJSONObject("123").getInt("volume")).isEqualTo(7);
        assertThat(store.isPersistentMode("123")).isTrue();
    }

    @Test
    void corruptFileReadsAsEmptyAndIsReplacedOnWrite() throws IOException {
        Files.writeString(dataDir.resolve("settings.json"), "{not json", StandardCharsets.UTF_8);
        JsonFileGuildSettingsStore store = new JsonFileGuildSettingsStore(dataDir);

        assertThat(store.isPersistentMode("123")).isFalse();

        store.setPersistentMode("123", true);
        assertThat(store.isPersistentMode("123")).isTrue();
    }

    @Test
    void createsMissingDataDirectory() {
        Path nested = dataDir.resolve("a").resolve("b");
        JsonFileGuildSettingsStore store = new JsonFileGuildSettingsStore(nested);

        store.setPersistentMode("1", true);

        assertThat(Files.isRegularFile(nested.resolve("settings.json"))).isTrue();
    }

    @Test
    void picksUpExternalEdits() throws IOException {
        JsonFileGuildSettingsStore store = new JsonFileGuildSettingsStore(dataDir);
        store.setPersistentMode("123", false);

        Files.writeString(dataDir.resolve("settings.json"),
                "{\"123\": {\"mode247Enabled\": true}}", StandardCharsets.UTF_8);

        assertThat(store.isPersistentMode("123")).isTrue();
    }
}
