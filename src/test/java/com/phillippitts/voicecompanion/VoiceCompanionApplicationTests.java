package com.phillippitts.voicecompanion;

import com.phillippitts.voicecompanion.config.IntegrationTestConfiguration;
import com.phillippitts.voicecompanion.service.voice.ConnectionSupervisor;
import com.phillippitts.voicecompanion.service.voice.VoiceState;
import com.phillippitts.voicecompanion.testutil.FakeAudioPlayer;
import com.phillippitts.voicecompanion.testutil.FakeVoiceTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("integration")
@Import(IntegrationTestConfiguration.class)
@SpringBootTest
@AutoConfigureMockMvc
class VoiceCompanionApplicationTests {

    private static final String OWNER = "100000000000000001";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private FakeVoiceTransport transport;

    @Autowired
    private ConnectionSupervisor supervisor;

    @AfterEach
    void tearDown() {
        supervisor.cleanupAll();
    }

    @Test
    void contextLoads() {
    }

    @Test
    void sayJoinsAndPlaysThroughTransport() throws Exception {
        mvc.perform(post("/guilds/it-say/say")
                        .header("X-User-ID", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channelId\":\"c1\",\"text\":\"hello there\"}"))
                .andExpect(status().isAccepted());

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> {
            FakeAudioPlayer player = transport.player("it-say");
            assertThat(player).isNotNull();
            assertThat(player.playedNames()).containsExactly("tts-1.mp3");
        });
        transport.player("it-say").finish();

        assertThat(supervisor.getState("it-say")).isEqualTo(VoiceState.READY);
        assertThat(supervisor.getChannelId("it-say")).contains("c1");
    }

    @Test
    void ownerPresenceChangeIsFollowed() throws Exception {
        mvc.perform(post("/gateway/voice-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"guildId\":\"it-follow\",\"userId\":\"" + OWNER + "\","
                                + "\"beforeChannelId\":null,\"afterChannelId\":\"c7\"}"))
                .andExpect(status().isAccepted());

        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertThat(supervisor.getChannelId("it-follow")).contains("c7"));
    }
}
