package quest.gekko.giveaway.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.giveaway.config.OverlayProperties;

/**
 * Drift-corrected countdown driver. Each tick is a fresh one-shot timer of
 * {@code min(tickInterval, remaining)}; the handler receives the wall-clock
 * time actually spent since the previous tick rather than the nominal interval.
 * Must only be used from the event loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TickScheduler {

    public interface TickHandler {
        /**
         * @param deltaMs wall-clock time since the previous tick or since start
         * @return remaining milliseconds after applying the delta; zero or less stops the scheduler
         */
        long onTick(long deltaMs);

        void onCheckpoint();
    }

    private final EventLoop loop;
    private final OverlayProperties.Timing timing;

    private TickHandler handler;
    private TimerHandle timer;
    private long lastTickClock;
    private long lastCheckpoint;

    public void start(long remainingMs, TickHandler handler) {
        stop();
        this.handler = handler;
        long now = loop.now();
        lastTickClock = now;
        lastCheckpoint = now;
        scheduleNext(remainingMs);
    }

    public void stop() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        handler = null;
    }

    public boolean isActive() {
        return handler != null;
    }

    private void scheduleNext(long remainingMs) {
        long delay = Math.min(timing.tickInterval().toMillis(), Math.max(0, remainingMs));
        timer = loop.schedule(this::fire, delay);
    }

    private void fire() {
        timer = null;
        TickHandler current = handler;
        if (current == null) return;

        long now = loop.now();
        long delta = now - lastTickClock;
        lastTickClock = now;

        long remaining = current.onTick(delta);
        // the handler may have stopped or restarted us (end of giveaway, pause)
        if (handler != current || timer != null) return;
        if (remaining <= 0) {
            handler = null;
            return;
        }

        if (now - lastCheckpoint >= timing.checkpointInterval().toMillis()) {
            lastCheckpoint = now;
            current.onCheckpoint();
        }
        scheduleNext(remaining);
    }
}
