package com.phillippitts.voicecompanion.service.sound;

import com.phillippitts.voicecompanion.config.properties.PlaybackProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves sound keys to {@code <soundsDir>/<key>.(wav|mp3|ogg|opus)}, first match wins.
 *
 * <p>Keys are restricted to {@code [a-z0-9_-]+} so a token can never escape the directory.
 */
@Component
public class DirectorySoundLibrary implements SoundLibrary {

    private static final Logger LOG = LogManager.getLogger(DirectorySoundLibrary.class);

    private static final Pattern KEY = Pattern.compile("[a-z0-9_-]+");
    private static final List<String> EXTENSIONS = List.of("wav", "mp3", "ogg", "opus");

    private final Path soundsDir;

    @Autowired
    public DirectorySoundLibrary(PlaybackProperties props) {
        this(Paths.get(props.getSoundsDir()));
    }

    public DirectorySoundLibrary(Path soundsDir) {
        this.soundsDir = soundsDir.toAbsolutePath().normalize();
        if (!Files.isDirectory(this.soundsDir)) {
            LOG.info("Sounds directory {} not found; sound triggers disabled until it exists", this.soundsDir);
        } else {
            LOG.info("Sound library initialized: dir={}", this.soundsDir);
        }
    }

    @Override
    public Optional<SoundSource> resolve(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.toLowerCase(Locale.ROOT);
        if (!KEY.matcher(normalized).matches()) {
            return Optional.empty();
        }
        for (String ext : EXTENSIONS) {
            Path candidate = soundsDir.resolve(normalized + "." + ext);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(new SoundSource(normalized, candidate));
            }
        }
        return Optional.empty();
    }

    Path directory() {
        return soundsDir;
    }
}
