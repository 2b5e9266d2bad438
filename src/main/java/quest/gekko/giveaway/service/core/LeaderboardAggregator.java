package quest.gekko.giveaway.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import quest.gekko.giveaway.config.OverlayProperties;
import quest.gekko.giveaway.domain.Contribution;
import quest.gekko.giveaway.domain.Metric;
import quest.gekko.giveaway.dto.LeaderboardEntry;
import quest.gekko.giveaway.event.ClientJoinedEvent;
import quest.gekko.giveaway.service.broadcast.BroadcastHub;
import quest.gekko.giveaway.service.scheduling.EventLoop;
import quest.gekko.giveaway.service.scheduling.TimerHandle;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory tallies of the active giveaway and the debounced leaderboard broadcasts
 * derived from them. Insertion order of the tally map is first-contribution order,
 * which is what ties fall back on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaderboardAggregator {
    private final GiveawayStore store;
    private final BroadcastHub hub;
    private final EventLoop loop;
    private final OverlayProperties.Timing timing;
    private final OverlayProperties.Leaderboard leaderboard;

    private final Map<String, Contribution> tallies = new LinkedHashMap<>();
    // at most one pending flush per metric; null when nothing is waiting
    private final Map<Metric, TimerHandle> pendingFlush = new EnumMap<>(Metric.class);
    private Long giveawayId;

    public void rebuild(Long giveawayId, List<Contribution> records) {
        clear();
        this.giveawayId = giveawayId;
        for (Contribution record : records) {
            tallies.put(record.getParticipantId(), record);
        }
        log.debug("Leaderboard cache for giveaway {} rebuilt with {} participants", giveawayId, tallies.size());
    }

    /** Drops the cache and any pending flush without broadcasting. */
    public void clear() {
        for (Metric metric : Metric.values()) {
            TimerHandle handle = pendingFlush.remove(metric);
            if (handle != null) handle.cancel();
        }
        tallies.clear();
        giveawayId = null;
    }

    public void record(String participantId, String displayName, long bitsDelta, long subsDelta) {
        if (giveawayId == null) throw new IllegalStateException("No giveaway is being tallied");
        if (participantId == null || participantId.isBlank()) throw new IllegalArgumentException("participantId is required");
        if (bitsDelta == 0 && subsDelta == 0) return;

        Contribution tally = tallies.get(participantId);
        if (tally == null) {
            tally = new Contribution(giveawayId, participantId, displayName);
            tallies.put(participantId, tally);
        } else {
            tally.rename(displayName);
        }
        tally.add(bitsDelta, subsDelta);
        store.saveContribution(tally);

        if (bitsDelta > 0) scheduleFlush(Metric.BITS);
        if (subsDelta > 0) scheduleFlush(Metric.SUBS);
    }

    public List<LeaderboardEntry> ranked(Metric metric) {
        // Stream.sorted is stable, so equal scores keep first-contribution order
        return tallies.values().stream()
                .filter(c -> metric.scoreOf(c) > 0)
                .sorted(Comparator.comparingLong(metric::scoreOf).reversed())
                .limit(Math.max(0, leaderboard.leadersCount(metric)))
                .map(c -> new LeaderboardEntry(c.getParticipantId(), c.nameForDisplay(), metric.scoreOf(c)))
                .toList();
    }

    public boolean isFlushPending(Metric metric) {
        return pendingFlush.get(metric) != null;
    }

    /** Broadcasts every metric that has a flush waiting, right now. */
    public void flushPending() {
        for (Metric metric : Metric.values()) {
            TimerHandle handle = pendingFlush.remove(metric);
            if (handle != null) {
                handle.cancel();
                broadcast(metric);
            }
        }
    }

    public void broadcastAll() {
        for (Metric metric : Metric.values()) {
            broadcast(metric);
        }
    }

    public void broadcastEmpty() {
        for (Metric metric : Metric.values()) {
            hub.broadcast(metric.updateEvent(), List.of());
        }
    }

    public int participantCount() {
        return tallies.size();
    }

    @Order(2)
    @EventListener
    public void onClientJoined(ClientJoinedEvent event) {
        for (Metric metric : Metric.values()) {
            hub.sendTo(event.client(), metric.updateEvent(), ranked(metric));
        }
    }

    private void scheduleFlush(Metric metric) {
        if (pendingFlush.get(metric) != null) return;
        pendingFlush.put(metric, loop.schedule(() -> {
            pendingFlush.remove(metric);
            broadcast(metric);
        }, timing.debounceWindow().toMillis()));
    }

    private void broadcast(Metric metric) {
        hub.broadcast(metric.updateEvent(), ranked(metric));
    }
}
