package fr.lapetina.llm.verifier.domain.adapter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpHeaders;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AdapterSupportTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    @DisplayName("should parse compound relative delays")
    void shouldParseRelativeDelays() {
        assertThat(AdapterSupport.parseRelativeDelay("20ms")).isEqualTo(Duration.ofMillis(20));
        assertThat(AdapterSupport.parseRelativeDelay("1m30s")).isEqualTo(Duration.ofSeconds(90));
        assertThat(AdapterSupport.parseRelativeDelay("1.5s")).isEqualTo(Duration.ofMillis(1500));
        assertThat(AdapterSupport.parseRelativeDelay("soon")).isNull();
    }

    @Test
    @DisplayName("should read reset headers as epoch seconds or relative seconds")
    void shouldReadResetHeaders() {
        HttpHeaders headers = HttpHeaders.of(Map.of(
                "epoch", List.of("1714564800"),
                "relative", List.of("30"),
                "garbage", List.of("later")
        ), (name, value) -> true);

        assertThat(AdapterSupport.resetHeader(headers, "epoch", NOW)).isEqualTo(Instant.ofEpochSecond(1714564800L));
        assertThat(AdapterSupport.resetHeader(headers, "relative", NOW)).isEqualTo(NOW.plusSeconds(30));
        assertThat(AdapterSupport.resetHeader(headers, "garbage", NOW)).isNull();
        assertThat(AdapterSupport.resetHeader(headers, "missing", NOW)).isNull();
    }

    @Test
    @DisplayName("should accept a plain string error body")
    void shouldParseStringError() {
        assertThat(AdapterSupport.parseProviderError(AdapterSupport.newObjectMapper(), "{\"error\":\"boom\"}"))
                .contains(new AdapterSupport.ProviderError("boom", null));
        assertThat(AdapterSupport.parseProviderError(AdapterSupport.newObjectMapper(), "<html>")).isEmpty();
    }
}
