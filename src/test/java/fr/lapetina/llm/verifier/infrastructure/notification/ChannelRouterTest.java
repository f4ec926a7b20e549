package fr.lapetina.llm.verifier.infrastructure.notification;

import fr.lapetina.llm.verifier.domain.event.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelRouterTest {

    private final ChannelRouter router = new ChannelRouter();

    private final NotificationChannel email = new RecordingChannel("email", ChannelWeight.HEAVY);
    private final NotificationChannel telegram = new RecordingChannel("telegram", ChannelWeight.STANDARD);
    private final NotificationChannel slack = new RecordingChannel("slack", ChannelWeight.LIGHT);
    private final NotificationChannel teams = new RecordingChannel("teams", ChannelWeight.LIGHT);

    private final List<NotificationChannel> all = List.of(email, telegram, slack, teams);

    @Test
    @DisplayName("should send critical and error events everywhere")
    void shouldBroadcastSevereEvents() {
        assertThat(router.route(Severity.CRITICAL, all)).containsExactlyElementsOf(all);
        assertThat(router.route(Severity.ERROR, all)).containsExactlyElementsOf(all);
    }

    @Test
    @DisplayName("should keep warnings out of heavy channels")
    void shouldSkipHeavyChannelsForWarnings() {
        assertThat(router.route(Severity.WARNING, all)).containsExactly(telegram, slack, teams);
    }

    @Test
    @DisplayName("should send info to the first of the lightest channels")
    void shouldSendInfoToLightestChannel() {
        assertThat(router.route(Severity.INFO, all)).containsExactly(slack);
        assertThat(router.route(Severity.INFO, List.of(email, telegram))).containsExactly(telegram);
    }

    @Test
    @DisplayName("should return nothing without channels")
    void shouldHandleNoChannels() {
        assertThat(router.route(Severity.CRITICAL, List.of())).isEmpty();
        assertThat(router.route(Severity.INFO, List.of())).isEmpty();
    }

    @Test
    @DisplayName("should route warnings nowhere when only heavy channels exist")
    void shouldDropWarningsWithOnlyHeavyChannels() {
        assertThat(router.route(Severity.WARNING, List.of(email))).isEmpty();
    }
}
