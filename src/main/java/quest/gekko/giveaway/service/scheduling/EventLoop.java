package quest.gekko.giveaway.service.scheduling;

import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * Single-threaded executor that owns every mutation of giveaway and leaderboard
 * state. Tasks run to completion one after another.
 */
public interface EventLoop {

    /** Monotonic milliseconds for measuring intervals; unrelated to the calendar. */
    long now();

    /** Calendar time, used only to stamp start and end of a giveaway. */
    Instant wallTime();

    void execute(Runnable task);

    /**
     * Runs the task on the loop and waits for its result. Runs inline when the
     * caller is already on the loop. Exceptions thrown by the task are rethrown
     * unchanged when unchecked.
     */
    <T> T call(Callable<T> task);

    default void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }

    TimerHandle schedule(Runnable task, long delayMs);
}
