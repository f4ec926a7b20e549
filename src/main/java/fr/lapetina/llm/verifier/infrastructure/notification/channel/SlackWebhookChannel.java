package fr.lapetina.llm.verifier.infrastructure.notification.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.adapter.AdapterSupport;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.infrastructure.notification.ChannelWeight;
import fr.lapetina.llm.verifier.infrastructure.notification.DeliveryException;
import fr.lapetina.llm.verifier.infrastructure.notification.Notification;
import fr.lapetina.llm.verifier.infrastructure.notification.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat webhook channel posting {@code {"text": ...}} to an incoming-webhook URL.
 */
public final class SlackWebhookChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookChannel.class);

    public static final String NAME = "slack";

    private final URI webhookUrl;
    private final String channel;
    private final String username;
    private final WebhookPoster poster;
    private final ObjectMapper objectMapper = AdapterSupport.newObjectMapper();

    public SlackWebhookChannel(URI webhookUrl, String channel, String username, HttpClient httpClient) {
        this.webhookUrl = webhookUrl;
        this.channel = channel;
        this.username = username;
        this.poster = new WebhookPoster(httpClient, NAME);
        log.info("Slack channel configured: host={}, channel={}", webhookUrl.getHost(), channel);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ChannelWeight weight() {
        return ChannelWeight.LIGHT;
    }

    @Override
    public String recipient() {
        return channel;
    }

    @Override
    public void deliver(Notification notification) throws DeliveryException {
        poster.post(webhookUrl, payload(notification));
    }

    String payload(Notification notification) throws DeliveryException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", "*" + notification.title() + "*\n" + notification.body());
        String target = notification.recipient() != null ? notification.recipient() : channel;
        if (target != null && !target.isBlank()) {
            body.put("channel", target);
        }
        if (username != null && !username.isBlank()) {
            body.put("username", username);
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DeliveryException(ErrorType.PARSE_ERROR, "Failed to render Slack payload", e);
        }
    }
}
