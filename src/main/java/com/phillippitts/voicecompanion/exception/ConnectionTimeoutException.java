package com.phillippitts.voicecompanion.exception;

import java.time.Duration;

/**
 * Thrown when a voice connection does not reach the ready state (or the transport does not
 * accept the connect request) within the configured bound.
 */
public class ConnectionTimeoutException extends VoiceCompanionException {

    private final String guildId;
    private final Duration timeout;

    public ConnectionTimeoutException(String guildId, String phase, Duration timeout) {
        super("Voice connection " + phase + " timed out after " + timeout.toMillis() + "ms (guild: " + guildId + ")");
        this.guildId = guildId;
        this.timeout = timeout;
    }

    public String getGuildId() {
        return guildId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
