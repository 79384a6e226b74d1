package com.phillippitts.voicecompanion.presentation.controller;

import com.phillippitts.voicecompanion.presentation.dto.MessageRequest;
import com.phillippitts.voicecompanion.presentation.dto.VoiceStateUpdateRequest;
import com.phillippitts.voicecompanion.service.follow.InProcessPresenceBus;
import com.phillippitts.voicecompanion.service.follow.MessageAutoReader;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Ingress for gateway events. Not owner-gated: the coordinator and auto-reader filter by author.
 */
@RestController
@RequestMapping("/gateway")
class GatewayController {

    private final InProcessPresenceBus presenceBus;
    private final MessageAutoReader autoReader;

    GatewayController(InProcessPresenceBus presenceBus, MessageAutoReader autoReader) {
        this.presenceBus = presenceBus;
        this.autoReader = autoReader;
    }

    @PostMapping("/voice-state")
    ResponseEntity<Void> voiceState(@Valid @RequestBody VoiceStateUpdateRequest request) {
        presenceBus.publish(request.toUpdate());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/messages")
    ResponseEntity<Map<String, String>> message(@Valid @RequestBody MessageRequest request) {
        MessageAutoReader.Verdict verdict = autoReader.onMessage(request.toMessage());
        return ResponseEntity.accepted().body(Map.of("verdict", verdict.name()));
    }
}
