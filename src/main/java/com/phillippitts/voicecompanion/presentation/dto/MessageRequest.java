package com.phillippitts.voicecompanion.presentation.dto;

import com.phillippitts.voicecompanion.service.follow.InboundMessage;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record MessageRequest(@NotBlank String guildId,
                             @NotBlank String channelId,
                             @NotBlank String authorId,
                             boolean bot,
                             String content,
                             List<InboundMessage.Attachment> attachments) {

    public InboundMessage toMessage() {
        return new InboundMessage(guildId, channelId, authorId, bot, content, attachments);
    }
}
