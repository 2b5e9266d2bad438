package quest.gekko.giveaway.service.scheduling;

/**
 * One-shot timer registered on the {@link EventLoop}. Cancelling a timer that
 * already fired or was already cancelled does nothing.
 */
public interface TimerHandle {
    void cancel();

    boolean isPending();
}
