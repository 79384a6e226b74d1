package com.phillippitts.voicecompanion.service.follow;

import java.util.function.Consumer;

/**
 * Source of raw voice presence updates from the platform gateway.
 *
 * Provides a test seam so unit tests can inject a fake and emit updates directly.
 */
public interface PresenceEventSource {

    void addListener(Consumer<VoicePresenceUpdate> listener);

    void removeListener(Consumer<VoicePresenceUpdate> listener);
}
