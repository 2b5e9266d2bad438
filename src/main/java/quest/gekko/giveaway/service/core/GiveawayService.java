package quest.gekko.giveaway.service.core;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import quest.gekko.giveaway.domain.Contribution;
import quest.gekko.giveaway.domain.Giveaway;
import quest.gekko.giveaway.domain.GiveawayState;
import quest.gekko.giveaway.dto.GiveawaySnapshot;
import quest.gekko.giveaway.event.ClientJoinedEvent;
import quest.gekko.giveaway.event.OwnerDeauthorizedEvent;
import quest.gekko.giveaway.exception.GiveawayConflictException;
import quest.gekko.giveaway.exception.NotAcceptingException;
import quest.gekko.giveaway.service.broadcast.BroadcastHub;
import quest.gekko.giveaway.service.scheduling.EventLoop;
import quest.gekko.giveaway.service.scheduling.TickScheduler;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owner of the current giveaway. Every method must be invoked on the event loop;
 * the loop is what keeps commands, ticks and contributions from interleaving.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayService {
    public static final String INFO_EVENT = "giveaway-info";
    public static final String TICK_EVENT = "giveaway-tick";

    private final GiveawayStore store;
    private final LeaderboardAggregator aggregator;
    private final BroadcastHub hub;
    private final EventLoop loop;
    private final TickScheduler ticks;

    private Giveaway current;

    public GiveawayState state() {
        return current == null ? GiveawayState.IDLE : current.state();
    }

    /** Snapshot of the current giveaway, or an empty object when idle. */
    public Object snapshot() {
        return current == null ? Map.of() : GiveawaySnapshot.of(current);
    }

    public Giveaway start(String ownerId, long durationMs) {
        if (current != null && !current.isTerminal()) {
            throw new GiveawayConflictException(current.getId());
        }
        Giveaway fresh = Giveaway.begin(ownerId, durationMs, now());
        // a suspended giveaway lives only in the store until its owner is authorized again
        Optional<Giveaway> suspended = store.findRecoverable(ownerId).filter(g -> !g.isExpired());
        if (suspended.isPresent()) {
            throw new GiveawayConflictException(suspended.get().getId());
        }

        Giveaway giveaway = store.create(fresh);
        current = giveaway;
        aggregator.rebuild(giveaway.getId(), List.of());
        log.info("Giveaway {} started for {} ({} ms)", giveaway.getId(), ownerId, durationMs);

        ticks.start(giveaway.remaining(), tickHandler());
        hub.broadcast(INFO_EVENT, snapshot());
        aggregator.broadcastEmpty();
        return giveaway;
    }

    public boolean pause() {
        if (state() != GiveawayState.RUNNING) return false;
        ticks.stop();
        current.pause();
        store.checkpoint(current);
        log.info("Giveaway {} paused at {} ms", current.getId(), current.getElapsedTime());
        hub.broadcast(TICK_EVENT, snapshot());
        return true;
    }

    public boolean resume() {
        if (state() != GiveawayState.PAUSED) return false;
        current.resume();
        store.checkpoint(current);
        log.info("Giveaway {} resumed with {} ms remaining", current.getId(), current.remaining());
        hub.broadcast(TICK_EVENT, snapshot());
        ticks.start(current.remaining(), tickHandler());
        return true;
    }

    public boolean cancel() {
        if (current == null || current.isTerminal()) return false;
        ticks.stop();
        current.cancel(now());
        store.checkpoint(current);
        log.info("Giveaway {} cancelled at {} ms", current.getId(), current.getElapsedTime());

        current = null;
        aggregator.clear();
        hub.broadcast(INFO_EVENT, snapshot());
        aggregator.broadcastEmpty();
        return true;
    }

    public void recordContribution(String participantId, String displayName, long bitsDelta, long subsDelta) {
        GiveawayState state = state();
        if (state != GiveawayState.RUNNING) throw new NotAcceptingException(state);
        aggregator.record(participantId, displayName, bitsDelta, subsDelta);
    }

    /**
     * Installs a giveaway read back from the store. It is always left paused; nothing
     * ticks until the operator resumes it.
     */
    public void adoptRecovered(Giveaway giveaway, List<Contribution> records) {
        if (current != null && !current.isTerminal()) {
            throw new GiveawayConflictException(current.getId());
        }
        if (giveaway.isTerminal()) throw new IllegalArgumentException("Giveaway " + giveaway.getId() + " is terminal");

        ticks.stop();
        if (!giveaway.isPaused()) giveaway.pause();
        store.checkpoint(giveaway);
        current = giveaway;
        aggregator.rebuild(giveaway.getId(), records);
        log.info("Recovered giveaway {} ({} ms remaining, {} participants), paused",
                giveaway.getId(), giveaway.remaining(), records.size());

        hub.broadcast(INFO_EVENT, snapshot());
        aggregator.broadcastAll();
    }

    /**
     * Pauses, checkpoints and forgets the current giveaway without cancelling it,
     * so that the same owner can pick it up again through recovery.
     */
    public boolean suspend() {
        if (current == null || current.isTerminal()) return false;
        ticks.stop();
        current.pause();
        store.checkpoint(current);
        log.info("Giveaway {} suspended", current.getId());

        current = null;
        aggregator.clear();
        hub.broadcast(INFO_EVENT, snapshot());
        aggregator.broadcastEmpty();
        return true;
    }

    @Order(1)
    @EventListener
    public void onClientJoined(ClientJoinedEvent event) {
        hub.sendTo(event.client(), INFO_EVENT, snapshot());
    }

    @EventListener
    public void onOwnerDeauthorized(OwnerDeauthorizedEvent event) {
        loop.run(this::suspend);
    }

    @PreDestroy
    public void shutdown() {
        loop.run(() -> {
            ticks.stop();
            if (current != null && !current.isTerminal()) {
                store.checkpoint(current);
                log.info("Giveaway {} checkpointed at shutdown ({} ms elapsed)", current.getId(), current.getElapsedTime());
            }
        });
    }

    private TickScheduler.TickHandler tickHandler() {
        return new TickScheduler.TickHandler() {
            @Override
            public long onTick(long deltaMs) {
                return tick(deltaMs);
            }

            @Override
            public void onCheckpoint() {
                if (current != null) store.checkpoint(current);
            }
        };
    }

    private long tick(long deltaMs) {
        if (state() != GiveawayState.RUNNING) return 0;
        current.advance(deltaMs);
        if (current.isExpired()) {
            end();
            return 0;
        }
        log.debug("Giveaway {} tick: {}/{} ms", current.getId(), current.getElapsedTime(), current.getDuration());
        hub.broadcast(TICK_EVENT, snapshot());
        return current.remaining();
    }

    private void end() {
        current.finish(now());
        store.checkpoint(current);
        log.info("Giveaway {} ended", current.getId());
        hub.broadcast(TICK_EVENT, snapshot());

        current = null;
        aggregator.flushPending();
        aggregator.clear();
        hub.broadcast(INFO_EVENT, snapshot());
    }

    private Instant now() {
        return loop.wallTime();
    }
}
