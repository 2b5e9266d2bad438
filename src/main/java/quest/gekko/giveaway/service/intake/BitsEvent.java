package quest.gekko.giveaway.service.intake;

/** Cheer notification as delivered by the platform event feed. */
public record BitsEvent(String userId, String userName, String displayName, long bits, boolean anonymous) {}
