package quest.gekko.giveaway.event;

public record OwnerDeauthorizedEvent(String ownerId) {}
