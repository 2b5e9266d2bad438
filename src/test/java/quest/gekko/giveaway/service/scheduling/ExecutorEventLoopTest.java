package quest.gekko.giveaway.service.scheduling;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ExecutorEventLoopTest {

    private final ExecutorEventLoop loop = new ExecutorEventLoop();

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void callRunsOnLoopThreadAndReturnsResult() {
        String thread = loop.call(() -> Thread.currentThread().getName());

        assertThat(thread).isEqualTo("giveaway-loop");
    }

    @Test
    void nestedCallRunsInline() {
        int result = loop.call(() -> loop.call(() -> 41) + 1);

        assertThat(result).isEqualTo(42);
    }

    @Test
    void uncheckedExceptionsReachTheCaller() {
        assertThatThrownBy(() -> loop.call(() -> {
            throw new IllegalArgumentException("nope");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("nope");
    }

    @Test
    void failingTaskDoesNotKillTheLoop() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        loop.execute(() -> {
            throw new IllegalStateException("boom");
        });
        loop.execute(done::countDown);

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void cancelledTimerNeverFires() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean();
        TimerHandle handle = loop.schedule(() -> fired.set(true), 200);

        assertThat(handle.isPending()).isTrue();
        handle.cancel();
        handle.cancel();

        Thread.sleep(400);
        assertThat(fired).isFalse();
        assertThat(handle.isPending()).isFalse();
    }

    @Test
    void scheduledTimerFires() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        TimerHandle handle = loop.schedule(fired::countDown, 20);

        assertThat(fired.await(2, TimeUnit.SECONDS)).isTrue();
        loop.run(() -> { });
        assertThat(handle.isPending()).isFalse();
    }

    @Test
    void intervalClockNeverRunsBackwards() {
        long previous = loop.now();
        for (int i = 0; i < 1_000; i++) {
            long current = loop.now();
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
        assertThat(loop.wallTime()).isCloseTo(Instant.now(), within(5, ChronoUnit.SECONDS));
    }
}
