package com.phillippitts.voicecompanion.service.follow;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Presence source fed by the gateway ingress endpoint.
 */
@Component
public class InProcessPresenceBus implements PresenceEventSource {

    private static final Logger LOG = LogManager.getLogger(InProcessPresenceBus.class);

    private final List<Consumer<VoicePresenceUpdate>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void addListener(Consumer<VoicePresenceUpdate> listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(Consumer<VoicePresenceUpdate> listener) {
        listeners.remove(listener);
    }

    /**
     * Delivers an update to every listener on the calling thread. A failing listener does not
     * prevent delivery to the others.
     */
    public void publish(VoicePresenceUpdate update) {
        for (Consumer<VoicePresenceUpdate> listener : listeners) {
            try {
                listener.accept(update);
            } catch (RuntimeException e) {
                LOG.error("Presence listener failed for guild {}", update.guildId(), e);
            }
        }
    }

    int listenerCount() {
        return listeners.size();
    }
}
