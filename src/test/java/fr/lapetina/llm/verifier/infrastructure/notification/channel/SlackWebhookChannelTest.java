package fr.lapetina.llm.verifier.infrastructure.notification.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.infrastructure.notification.DeliveryException;
import fr.lapetina.llm.verifier.infrastructure.notification.Notification;
import fr.lapetina.llm.verifier.testsupport.FakeProviderServer;
import fr.lapetina.llm.verifier.testsupport.FakeProviderServer.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlackWebhookChannelTest {

    private static final String HOOK_PATH = "/v1/hooks/T000/B000";

    private FakeProviderServer server;
    private SlackWebhookChannel channel;

    @BeforeEach
    void setUp() {
        server = FakeProviderServer.start();
        channel = new SlackWebhookChannel(URI.create(server.baseUrl() + "/hooks/T000/B000"),
                "#llm-alerts", "llm-verifier", HttpClient.newHttpClient());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("should post title and body as Slack text")
    void shouldPostMessage() throws Exception {
        server.on("POST", HOOK_PATH, Response.json(200, "ok"));

        channel.deliver(Notification.of("slack", null, "[ERROR] Verification failed", "provider: openai"));

        JsonNode body = new ObjectMapper().readTree(server.lastRequest(HOOK_PATH).body());
        assertThat(body.get("text").asText()).isEqualTo("*[ERROR] Verification failed*\nprovider: openai");
        assertThat(body.get("channel").asText()).isEqualTo("#llm-alerts");
        assertThat(body.get("username").asText()).isEqualTo("llm-verifier");
        assertThat(server.lastRequest(HOOK_PATH).headers().get("content-type")).contains("application/json");
    }

    @Test
    @DisplayName("should prefer the notification recipient over the default channel")
    void shouldUseNotificationRecipient() throws Exception {
        JsonNode body = new ObjectMapper().readTree(channel.payload(Notification.of("slack", "#other", "t", "b")));

        assertThat(body.get("channel").asText()).isEqualTo("#other");
    }

    @Test
    @DisplayName("should classify rejected webhooks")
    void shouldClassifyRejections() {
        server.on("POST", HOOK_PATH, Response.json(404, "no_service"));

        assertThatThrownBy(() -> channel.deliver(Notification.of("slack", null, "t", "b")))
                .isInstanceOf(DeliveryException.class)
                .hasMessage("slack returned HTTP 404: no_service")
                .extracting(e -> ((DeliveryException) e).getErrorType())
                .isEqualTo(ErrorType.NOT_FOUND);
    }

    @Test
    @DisplayName("should report unreachable webhooks as transport errors")
    void shouldReportTransportErrors() {
        SlackWebhookChannel unreachable = new SlackWebhookChannel(URI.create("http://localhost:1/hook"),
                null, null, HttpClient.newHttpClient());

        assertThatThrownBy(() -> unreachable.deliver(Notification.of("slack", null, "t", "b")))
                .isInstanceOf(DeliveryException.class)
                .extracting(e -> ((DeliveryException) e).getErrorType())
                .isEqualTo(ErrorType.TRANSPORT_ERROR);
    }
}
