package quest.gekko.giveaway.dto;

public record AuthStateDTO(boolean authorized, String ownerId) {}
