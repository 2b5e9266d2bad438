package quest.gekko.giveaway.exception;

/**
 * Thrown when a giveaway is started while another one is still running or paused.
 */
public class GiveawayConflictException extends RuntimeException {
    public GiveawayConflictException(Long activeId) {
        super("Giveaway " + activeId + " is still active");
    }
}
