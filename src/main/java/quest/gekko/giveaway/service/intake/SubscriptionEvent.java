package quest.gekko.giveaway.service.intake;

/** Subscription notification; only gifted subscriptions count toward the giveaway. */
public record SubscriptionEvent(String gifterId, String gifterName, String gifterDisplayName,
                                boolean gift, boolean anonymous) {}
