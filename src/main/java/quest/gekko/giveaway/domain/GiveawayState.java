package quest.gekko.giveaway.domain;

public enum GiveawayState {
    IDLE,
    RUNNING,
    PAUSED,
    ENDED,
    CANCELLED
}
