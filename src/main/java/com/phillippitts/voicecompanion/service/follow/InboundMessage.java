package com.phillippitts.voicecompanion.service.follow;

import java.util.List;
import java.util.Objects;

/**
 * A chat message seen by the gateway.
 *
 * @param channelId text channel, or the voice channel id for voice-chat messages
 */
public record InboundMessage(String guildId,
                             String channelId,
                             String authorId,
                             boolean authorIsBot,
                             String content,
                             List<Attachment> attachments) {

    public InboundMessage {
        Objects.requireNonNull(guildId, "guildId");
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(authorId, "authorId");
        content = content == null ? "" : content;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    /**
     * @param contentType MIME type reported by the platform, may be null
     */
    public record Attachment(String name, String contentType) {
    }
}
