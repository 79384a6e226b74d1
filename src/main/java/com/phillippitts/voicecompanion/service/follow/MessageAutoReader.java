package com.phillippitts.voicecompanion.service.follow;

import com.phillippitts.voicecompanion.config.properties.FollowProperties;
import com.phillippitts.voicecompanion.exception.VoiceCompanionException;
import com.phillippitts.voicecompanion.service.playback.PlaybackQueue;
import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceConnection;
import com.phillippitts.voicecompanion.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the owner's voice-chat messages aloud.
 *
 * <p>A message is read only when all of these hold:
 * <ul>
 *   <li>the author is the owner and not a bot</li>
 *   <li>the guild session is READY and the message was posted in the bound channel's chat</li>
 *   <li>the content is non-blank, does not start with {@code .} or {@code ,}, and has no link</li>
 *   <li>no attachment is an image</li>
 * </ul>
 * Messages are debounced per guild and author; only the last one of a burst is spoken.
 */
@Service
public class MessageAutoReader {

    private static final Logger LOG = LogManager.getLogger(MessageAutoReader.class);

    private static final Pattern URL = Pattern.compile("(https?://|www\\.)\\S+", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMAGE_NAME = Pattern.compile(".*\\.(png|jpe?g|gif|webp|bmp|svg)$");

    /** Why a message was not scheduled for reading. */
    public enum Verdict {
        SCHEDULED,
        NOT_OWNER,
        BOT_AUTHOR,
        NOT_CONNECTED,
        OTHER_CHANNEL,
        IGNORED_PREFIX,
        NOT_TEXT
    }

    private final ConnectionSupervisor supervisor;
    private final PlaybackQueue queue;
    private final FollowProperties props;
    private final KeyedDebouncer<InboundMessage> debouncer;

    public MessageAutoReader(ConnectionSupervisor supervisor,
                             PlaybackQueue queue,
                             FollowProperties props,
                             @Qualifier("voiceTaskScheduler") TaskScheduler scheduler) {
        this.supervisor = supervisor;
        this.queue = queue;
        this.props = props;
        this.debouncer = new KeyedDebouncer<>(scheduler, Duration.ofMillis(props.getAutoReadDebounceMs()),
                KeyedDebouncer.keepLatest(), (key, message) -> read(message));
    }

    public Verdict onMessage(InboundMessage message) {
        Verdict verdict = evaluate(message);
        if (verdict == Verdict.SCHEDULED) {
            debouncer.submit(message.guildId() + "-" + message.authorId(), message);
        } else {
            LOG.debug("Auto-read skipped in guild {}: {}", message.guildId(), verdict);
        }
        return verdict;
    }

    Verdict evaluate(InboundMessage message) {
        if (message.authorIsBot()) {
            return Verdict.BOT_AUTHOR;
        }
        if (!props.isOwner(message.authorId())) {
            return Verdict.NOT_OWNER;
        }
        Optional<String> boundChannel = supervisor.isReady(message.guildId())
                ? supervisor.getChannelId(message.guildId())
                : Optional.empty();
        if (boundChannel.isEmpty()) {
            return Verdict.NOT_CONNECTED;
        }
        String content = message.content();
        if (content.startsWith(".") || content.startsWith(",")) {
            return Verdict.IGNORED_PREFIX;
        }
        if (isNotReadableText(message)) {
            return Verdict.NOT_TEXT;
        }
        if (!boundChannel.get().equals(message.channelId())) {
            return Verdict.OTHER_CHANNEL;
        }
        return Verdict.SCHEDULED;
    }

    static boolean isNotReadableText(InboundMessage message) {
        String content = message.content().trim();
        if (content.isEmpty() || URL.matcher(content).find()) {
            return true;
        }
        for (InboundMessage.Attachment attachment : message.attachments()) {
            String type = attachment.contentType() == null ? "" : attachment.contentType().toLowerCase(Locale.ROOT);
            String name = attachment.name() == null ? "" : attachment.name().toLowerCase(Locale.ROOT);
            if (type.startsWith("image/") || IMAGE_NAME.matcher(name).matches()) {
                return true;
            }
        }
        return false;
    }

    private void read(InboundMessage message) {
        Optional<VoiceConnection> connection = supervisor.getConnection(message.guildId());
        if (connection.isEmpty()) {
            LOG.warn("No voice connection for auto-read in guild {}", message.guildId());
            return;
        }
        try {
            queue.enqueue(message.guildId(), message.content(), connection.get());
            LOG.info("Auto-reading message in guild {}: '{}'", message.guildId(),
                    LogSanitizer.preview(message.content()));
        } catch (VoiceCompanionException e) {
            LOG.warn("Auto-read rejected in guild {}: {}", message.guildId(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Auto-read failed in guild {}", message.guildId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        debouncer.cancelAll();
    }
}
