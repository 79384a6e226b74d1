package com.phillippitts.voicecompanion.presentation.controller;

import com.phillippitts.voicecompanion.presentation.dto.PersistentModeRequest;
import com.phillippitts.voicecompanion.presentation.dto.PersistentModeResponse;
import com.phillippitts.voicecompanion.presentation.dto.RecentAudioResponse;
import com.phillippitts.voicecompanion.presentation.dto.SayRequest;
import com.phillippitts.voicecompanion.presentation.dto.SayResponse;
import com.phillippitts.voicecompanion.presentation.security.OwnerGuard;
import com.phillippitts.voicecompanion.service.playback.EnqueueReceipt;
import com.phillippitts.voicecompanion.service.playback.PlaybackQueue;
import com.phillippitts.voicecompanion.service.settings.GuildSettingsStore;
import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceChannel;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceConnection;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Owner commands for a guild: speak text, stop playback, toggle persistent mode,
 * list recent audio and discard all guild state.
 */
@RestController
@RequestMapping("/guilds/{guildId}")
class GuildPlaybackController {

    private static final Logger LOG = LogManager.getLogger(GuildPlaybackController.class);

    private final ConnectionSupervisor supervisor;
    private final PlaybackQueue queue;
    private final GuildSettingsStore settings;
    private final OwnerGuard ownerGuard;

    GuildPlaybackController(ConnectionSupervisor supervisor,
                            PlaybackQueue queue,
                            GuildSettingsStore settings,
                            OwnerGuard ownerGuard) {
        this.supervisor = supervisor;
        this.queue = queue;
        this.settings = settings;
        this.ownerGuard = ownerGuard;
    }

    /**
     * Joins the owner's channel when not already bound there, then queues the text.
     */
    @PostMapping("/say")
    ResponseEntity<SayResponse> say(@PathVariable String guildId,
                                    @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false) String userId,
                                    @Valid @RequestBody SayRequest request) {
        ownerGuard.requireOwner(userId);
        VoiceConnection connection = supervisor.join(new VoiceChannel(guildId, request.channelId()));
        EnqueueReceipt receipt = queue.enqueue(guildId, request.text(), connection);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SayResponse.from(receipt, request.channelId()));
    }

    @PostMapping("/stop")
    ResponseEntity<Void> stop(@PathVariable String guildId,
                              @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false) String userId) {
        ownerGuard.requireOwner(userId);
        queue.stop(guildId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/persistent-mode")
    ResponseEntity<PersistentModeResponse> persistentMode(
            @PathVariable String guildId,
            @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false) String userId,
            @RequestBody(required = false) PersistentModeRequest request) {
        ownerGuard.requireOwner(userId);
        boolean enabled = (request == null || request.enabled() == null)
                ? !settings.isPersistentMode(guildId)
                : request.enabled();
        settings.setPersistentMode(guildId, enabled);
        return ResponseEntity.ok(new PersistentModeResponse(guildId, enabled));
    }

    @GetMapping("/recent-audio")
    ResponseEntity<List<RecentAudioResponse>> recentAudio(
            @PathVariable String guildId,
            @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false) String userId) {
        ownerGuard.requireOwner(userId);
        List<RecentAudioResponse> body = queue.recentAudio(guildId).stream()
                .map(a -> new RecentAudioResponse(a.name(), a.size(), a.at()))
                .toList();
        return ResponseEntity.ok(body);
    }

    /**
     * Guild removed from the platform: drop playback and voice state.
     */
    @DeleteMapping
    ResponseEntity<Void> removeGuild(@PathVariable String guildId,
                                     @RequestHeader(value = OwnerGuard.USER_ID_HEADER, required = false)
                                     String userId) {
        ownerGuard.requireOwner(userId);
        queue.cleanup(guildId);
        supervisor.cleanup(guildId);
        LOG.info("Guild {} state removed", guildId);
        return ResponseEntity.noContent().build();
    }
}
