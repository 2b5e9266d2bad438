package quest.gekko.giveaway.exception;

import quest.gekko.giveaway.domain.GiveawayState;

/** A contribution arrived while no giveaway was running. */
public class NotAcceptingException extends RuntimeException {
    public NotAcceptingException(GiveawayState state) {
        super("Contributions are not accepted while " + state);
    }
}
