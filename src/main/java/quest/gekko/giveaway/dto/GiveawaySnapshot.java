package quest.gekko.giveaway.dto;

import quest.gekko.giveaway.domain.Giveaway;

import java.time.Instant;

/**
 * Self-sufficient view of the current giveaway as sent to clients in
 * {@code giveaway-info} and {@code giveaway-tick} frames.
 */
public record GiveawaySnapshot(
        Long id,
        String ownerId,
        Instant startTime,
        Instant endTime,
        long duration,
        long elapsedTime,
        boolean paused,
        boolean cancelled
) {
    public static GiveawaySnapshot of(Giveaway g) {
        return new GiveawaySnapshot(g.getId(), g.getOwnerId(), g.getStartTime(), g.getEndTime(),
                g.getDuration(), g.getElapsedTime(), g.isPaused(), g.isCancelled());
    }
}
