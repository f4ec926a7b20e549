package fr.lapetina.llm.verifier.infrastructure.notification.channel;

import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.infrastructure.notification.DeliveryException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * JSON POST helper shared by the HTTP-based channels.
 */
final class WebhookPoster {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    private static final int MAX_ERROR_BODY = 200;

    private final HttpClient httpClient;
    private final String channel;

    WebhookPoster(HttpClient httpClient, String channel) {
        this.httpClient = httpClient;
        this.channel = channel;
    }

    /**
     * @return the response body of a 2xx response
     * @throws DeliveryException on transport failure or any non-2xx status
     */
    String post(URI uri, String json) throws DeliveryException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException(ErrorType.TRANSPORT_ERROR,
                    channel + " request failed: " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException(ErrorType.TRANSPORT_ERROR, channel + " request interrupted", e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        throw new DeliveryException(errorType(status),
                channel + " returned HTTP " + status + ": " + abbreviate(response.body()));
    }

    static ErrorType errorType(int status) {
        if (status == 401 || status == 403) {
            return ErrorType.UNAUTHORIZED;
        }
        if (status == 404) {
            return ErrorType.NOT_FOUND;
        }
        if (status == 429) {
            return ErrorType.RATE_LIMITED;
        }
        if (status >= 500) {
            return ErrorType.SERVER_ERROR;
        }
        return ErrorType.UNCLASSIFIED;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
