package quest.gekko.giveaway.domain;

import java.util.function.ToLongFunction;

/**
 * Leaderboard metrics; each one ranks contributions by a single tally.
 */
public enum Metric {
    BITS("bits", Contribution::getBits),
    SUBS("subs", Contribution::getSubs);

    private final String wireName;
    private final ToLongFunction<Contribution> score;

    Metric(String wireName, ToLongFunction<Contribution> score) {
        this.wireName = wireName;
        this.score = score;
    }

    public long scoreOf(Contribution contribution) {
        return score.applyAsLong(contribution);
    }

    /** Name of the outbound frame carrying this metric's ranked list. */
    public String updateEvent() {
        return "leaderboard-" + wireName + "-update";
    }

    public String wireName() {
        return wireName;
    }
}
