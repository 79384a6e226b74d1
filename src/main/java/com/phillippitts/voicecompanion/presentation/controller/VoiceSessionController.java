package com.phillippitts.voicecompanion.presentation.controller;

import com.phillippitts.voicecompanion.presentation.dto.ChannelRequest;
import com.phillippitts.voicecompanion.presentation.security.OwnerGuard;
import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.VoiceSessionStatus;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceChannel;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Owner-only inspection and explicit control of a guild's voice session.
 */
@RestController
@RequestMapping("/guilds/{guildId}/voice")
class VoiceSessionController {

    private final ConnectionSupervisor supervisor;
    private final OwnerGuard ownerGuard;

    VoiceSessionController(ConnectionSupervisor supervisor, OwnerGuard ownerGuard) {
        this.supervisor = supervisor;
        this.ownerGuard = ownerGuard;
    }

    @GetMapping
    ResponseEntity<VoiceSessionStatus> status(@PathVariable String guildId,
                                              @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false)
                                              String userId) {
        ownerGuard.requireOwner(userId);
        return ResponseEntity.ok(supervisor.snapshot(guildId));
    }

    @PostMapping("/join")
    ResponseEntity<VoiceSessionStatus> join(@PathVariable String guildId,
                                            @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false)
                                            String userId,
                                            @Valid @RequestBody ChannelRequest request) {
        ownerGuard.requireOwner(userId);
        supervisor.join(new VoiceChannel(guildId, request.channelId()));
        return ResponseEntity.ok(supervisor.snapshot(guildId));
    }

    @PostMapping("/move")
    ResponseEntity<VoiceSessionStatus> move(@PathVariable String guildId,
                                            @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false)
                                            String userId,
                                            @Valid @RequestBody ChannelRequest request) {
        ownerGuard.requireOwner(userId);
        supervisor.move(new VoiceChannel(guildId, request.channelId()));
        return ResponseEntity.ok(supervisor.snapshot(guildId));
    }

    @DeleteMapping
    ResponseEntity<Void> leave(@PathVariable String guildId,
                               @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false) String userId) {
        ownerGuard.requireOwner(userId);
        supervisor.leave(guildId);
        return ResponseEntity.noContent().build();
    }
}
