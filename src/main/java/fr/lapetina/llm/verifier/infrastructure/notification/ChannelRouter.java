package fr.lapetina.llm.verifier.infrastructure.notification;

import fr.lapetina.llm.verifier.domain.event.Severity;

import java.util.List;

/**
 * Selects the channels an event of a given severity goes to.
 *
 * <ul>
 *   <li>CRITICAL and ERROR: every channel</li>
 *   <li>WARNING: every channel except HEAVY ones</li>
 *   <li>INFO: the single lightest channel, the first registered on ties</li>
 * </ul>
 */
public final class ChannelRouter {

    public List<NotificationChannel> route(Severity severity, List<NotificationChannel> channels) {
        if (channels.isEmpty()) {
            return List.of();
        }
        return switch (severity) {
            case CRITICAL, ERROR -> List.copyOf(channels);
            case WARNING -> channels.stream()
                    .filter(c -> c.weight() != ChannelWeight.HEAVY)
                    .toList();
            case INFO -> List.of(lightest(channels));
        };
    }

    private static NotificationChannel lightest(List<NotificationChannel> channels) {
        NotificationChannel lightest = channels.get(0);
        for (NotificationChannel channel : channels) {
            if (channel.weight().compareTo(lightest.weight()) < 0) {
                lightest = channel;
            }
        }
        return lightest;
    }
}
