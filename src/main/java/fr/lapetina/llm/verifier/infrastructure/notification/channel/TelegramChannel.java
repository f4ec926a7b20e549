package fr.lapetina.llm.verifier.infrastructure.notification.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.adapter.AdapterSupport;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.infrastructure.notification.ChannelWeight;
import fr.lapetina.llm.verifier.infrastructure.notification.DeliveryException;
import fr.lapetina.llm.verifier.infrastructure.notification.Notification;
import fr.lapetina.llm.verifier.infrastructure.notification.NotificationChannel;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bot API channel calling {@code sendMessage} for one chat.
 * The bot token is part of the URL and never logged.
 */
public final class TelegramChannel implements NotificationChannel {

    public static final String NAME = "telegram";

    // Bot API rejects longer messages
    static final int MAX_MESSAGE_LENGTH = 4096;

    private final URI sendMessageUri;
    private final String chatId;
    private final WebhookPoster poster;
    private final ObjectMapper objectMapper = AdapterSupport.newObjectMapper();

    public TelegramChannel(String apiBaseUrl, String botToken, String chatId, HttpClient httpClient) {
        String base = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.sendMessageUri = URI.create(base + "/bot" + botToken + "/sendMessage");
        this.chatId = chatId;
        this.poster = new WebhookPoster(httpClient, NAME);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ChannelWeight weight() {
        return ChannelWeight.STANDARD;
    }

    @Override
    public String recipient() {
        return chatId;
    }

    @Override
    public void deliver(Notification notification) throws DeliveryException {
        String response = poster.post(sendMessageUri, payload(notification));
        try {
            JsonNode root = objectMapper.readTree(response);
            if (!root.path("ok").asBoolean(false)) {
                throw new DeliveryException(ErrorType.UNCLASSIFIED,
                        "telegram rejected message: " + AdapterSupport.text(root.path("description")));
            }
        } catch (JsonProcessingException e) {
            throw new DeliveryException(ErrorType.PARSE_ERROR, "telegram returned invalid JSON", e);
        }
    }

    String payload(Notification notification) throws DeliveryException {
        String text = notification.title() + "\n\n" + notification.body();
        if (text.length() > MAX_MESSAGE_LENGTH) {
            text = text.substring(0, MAX_MESSAGE_LENGTH);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", notification.recipient() != null ? notification.recipient() : chatId);
        body.put("text", text);
        body.put("disable_web_page_preview", true);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DeliveryException(ErrorType.PARSE_ERROR, "Failed to render Telegram payload", e);
        }
    }
}
