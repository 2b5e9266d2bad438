package quest.gekko.giveaway.event;

public record OwnerAuthorizedEvent(String ownerId) {}
