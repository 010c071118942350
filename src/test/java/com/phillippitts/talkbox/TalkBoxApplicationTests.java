package com.phillippitts.talkbox;

import com.phillippitts.talkbox.domain.Source;
import com.phillippitts.talkbox.service.lifecycle.LifecycleCoordinator;
import com.phillippitts.talkbox.service.reply.ReplyGenerator;
import com.phillippitts.talkbox.service.supervisor.ConnectionState;
import com.phillippitts.talkbox.service.supervisor.ConnectionStatusRegistry;
import com.phillippitts.talkbox.service.tts.SpeechSynthesizer;
import com.phillippitts.talkbox.testutil.FakeAvatarController;
import com.phillippitts.talkbox.testutil.FakeInteractiveAdapter;
import com.phillippitts.talkbox.testutil.FakeReplyGenerator;
import com.phillippitts.talkbox.testutil.FakeSpeechSynthesizer;
import com.phillippitts.talkbox.testutil.RecordingPlaybackSink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TalkBoxApplicationTests {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private RecordingPlaybackSink sink;

    @Autowired
    private FakeAvatarController avatar;

    @Autowired
    private LifecycleCoordinator coordinator;

    @Autowired
    private ConnectionStatusRegistry connections;

    @Test
    void shouldSpeakQueuedEventEndToEnd() throws Exception {
        // Arrange
        await().atMost(Duration.ofSeconds(5)).until(() -> connections.statuses().stream()
                .anyMatch(c -> c.name().equals("test-chat") && c.state() == ConnectionState.CONNECTED));

        // Act
        mvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"hello there\",\"source\":\"live-chat\",\"userId\":\"u1\",\"userName\":\"Alice\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.outcome").value("QUEUED"));

        // Assert
        await().atMost(Duration.ofSeconds(5)).until(() -> sink.played().size() == 1);
        await().atMost(Duration.ofSeconds(2)).until(() -> avatar.count("talking:false") == 1);
        assertThat(coordinator.isRunning()).isTrue();
        assertThat(coordinator.isAvatarConnected()).isTrue();
        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pipeline.completed").value(1));
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void shouldRejectInvalidEventBody() throws Exception {
        mvc.perform(post("/api/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"\",\"source\":\"text\",\"userId\":\"u1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MethodArgumentNotValidException"));
    }

    @TestConfiguration
    static class Collaborators {

        @Bean
        ReplyGenerator replyGenerator() {
            return new FakeReplyGenerator();
        }

        @Bean
        SpeechSynthesizer speechSynthesizer() {
            return new FakeSpeechSynthesizer();
        }

        @Bean
        RecordingPlaybackSink playbackSink() {
            return new RecordingPlaybackSink();
        }

        @Bean
        FakeAvatarController avatarController() {
            return new FakeAvatarController();
        }

        @Bean
        FakeInteractiveAdapter testChatAdapter() {
            return new FakeInteractiveAdapter("test-chat", Set.of(Source.LIVE_CHAT), 0);
        }
    }
}
