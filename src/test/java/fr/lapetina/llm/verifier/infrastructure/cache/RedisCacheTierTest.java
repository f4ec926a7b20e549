package fr.lapetina.llm.verifier.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.llm.verifier.domain.adapter.AdapterSupport;
import fr.lapetina.llm.verifier.domain.model.ErrorType;
import fr.lapetina.llm.verifier.domain.model.ProbeKind;
import fr.lapetina.llm.verifier.domain.model.ProbeResult;
import fr.lapetina.llm.verifier.domain.model.TaxonomyError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisCacheTierTest {

    @Mock
    private JedisPool pool;

    @Mock
    private Jedis jedis;

    private final ObjectMapper mapper = AdapterSupport.newObjectMapper();
    private RedisCacheTier<ProbeResult> tier;

    @BeforeEach
    void setUp() {
        when(pool.getResource()).thenReturn(jedis);
        tier = new RedisCacheTier<>(pool, mapper, ProbeResult.class, "llm-verifier:probe:");
    }

    @Test
    @DisplayName("should decode a stored probe result")
    void shouldDecodeStoredValue() throws Exception {
        ProbeResult stored = ProbeResult.builder(ProbeKind.STREAMING)
                .error(TaxonomyError.of(ErrorType.RATE_LIMITED, 429, "Slow down"))
                .httpStatus(429)
                .latency(Duration.ofMillis(250))
                .completedAt(Instant.parse("2024-05-01T12:00:00Z"))
                .build();
        when(jedis.get("llm-verifier:probe:openai:gpt-4o:streaming")).thenReturn(mapper.writeValueAsString(stored));

        Optional<ProbeResult> result = tier.get("openai:gpt-4o:streaming");

        assertThat(result).contains(stored);
    }

    @Test
    @DisplayName("should treat connection failures and garbage as misses")
    void shouldTreatFailuresAsMisses() {
        when(jedis.get("llm-verifier:probe:down")).thenThrow(new JedisConnectionException("refused"));
        when(jedis.get("llm-verifier:probe:garbage")).thenReturn("{not json");

        assertThat(tier.get("down")).isEmpty();
        assertThat(tier.get("garbage")).isEmpty();
    }

    @Test
    @DisplayName("should report the remaining lifetime from PTTL")
    void shouldReadRemainingTtl() {
        when(jedis.pttl("llm-verifier:probe:live")).thenReturn(1_500L);
        when(jedis.pttl("llm-verifier:probe:gone")).thenReturn(-2L);
        when(jedis.pttl("llm-verifier:probe:forever")).thenReturn(-1L);

        assertThat(tier.remainingTtl("live")).contains(Duration.ofMillis(1_500));
        assertThat(tier.remainingTtl("gone")).contains(Duration.ZERO);
        assertThat(tier.remainingTtl("forever")).isEmpty();
    }

    @Test
    @DisplayName("should report an unknown lifetime when PTTL fails")
    void shouldTreatPttlFailureAsUnknown() {
        when(jedis.pttl(anyString())).thenThrow(new JedisConnectionException("refused"));

        assertThat(tier.remainingTtl("k")).isEmpty();
    }

    @Test
    @DisplayName("should store with a millisecond TTL under the prefix")
    void shouldStoreWithTtl() {
        tier.set("k", ProbeResult.builder(ProbeKind.EXISTENCE).passed(true).build(), Duration.ofMinutes(1));

        verify(jedis).psetex(eq("llm-verifier:probe:k"), eq(60_000L), anyString());
    }

    @Test
    @DisplayName("should swallow write failures")
    void shouldSwallowWriteFailures() {
        when(jedis.psetex(anyString(), anyLong(), anyString())).thenThrow(new JedisConnectionException("refused"));

        tier.set("k", ProbeResult.builder(ProbeKind.EXISTENCE).passed(true).build(), Duration.ofMinutes(1));

        verify(jedis).close();
    }

    @Test
    @DisplayName("should clear only keys under its prefix")
    void shouldClearPrefixedKeys() {
        when(jedis.scan(eq(ScanParams.SCAN_POINTER_START), any(ScanParams.class)))
                .thenReturn(new ScanResult<>(ScanParams.SCAN_POINTER_START,
                        List.of("llm-verifier:probe:a", "llm-verifier:probe:b")));

        tier.clear();

        verify(jedis).del("llm-verifier:probe:a", "llm-verifier:probe:b");
    }
}
