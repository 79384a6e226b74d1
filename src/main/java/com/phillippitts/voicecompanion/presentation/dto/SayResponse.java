package com.phillippitts.voicecompanion.presentation.dto;

import com.phillippitts.voicecompanion.service.playback.EnqueueReceipt;

import java.util.List;

public record SayResponse(String guildId, String channelId, List<Item> items, int queueDepth) {

    public record Item(long sequenceId, String kind, String text) {
    }

    public static SayResponse from(EnqueueReceipt receipt, String channelId) {
        List<Item> items = receipt.items().stream()
                .map(i -> new Item(i.sequenceId(), i.kind().name(), i.text()))
                .toList();
        return new SayResponse(receipt.guildId(), channelId, items, receipt.queueDepth());
    }
}
