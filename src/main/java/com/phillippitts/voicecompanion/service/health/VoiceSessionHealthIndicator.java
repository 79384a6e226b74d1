package com.phillippitts.voicecompanion.service.health;

import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.VoiceSessionStatus;
import com.phillippitts.voicecompanion.service.voice.VoiceState;
import com.phillippitts.voicecompanion.service.voice.transport.UnavailableVoiceTransport;
import com.phillippitts.voicecompanion.service.voice.transport.VoiceTransport;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for voice sessions.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: a transport adapter is configured; details list session counts by state</li>
 *   <li>DEGRADED: no transport adapter, so joins always fail</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class VoiceSessionHealthIndicator implements HealthIndicator {

    private final ConnectionSupervisor supervisor;
    private final VoiceTransport transport;

    public VoiceSessionHealthIndicator(ConnectionSupervisor supervisor, VoiceTransport transport) {
        this.supervisor = supervisor;
        this.transport = transport;
    }

    @Override
    public Health health() {
        List<VoiceSessionStatus> sessions = supervisor.snapshotAll();
        Map<VoiceState, Integer> byState = new EnumMap<>(VoiceState.class);
        for (VoiceSessionStatus s : sessions) {
            byState.merge(s.state(), 1, Integer::sum);
        }

        Health.Builder builder = transport instanceof UnavailableVoiceTransport
                ? new Health.Builder().status("DEGRADED").withDetail("transport", "not configured")
                : new Health.Builder().up().withDetail("transport", transport.getClass().getSimpleName());

        return builder
                .withDetail("sessions", sessions.size())
                .withDetail("byState", byState)
                .build();
    }
}
