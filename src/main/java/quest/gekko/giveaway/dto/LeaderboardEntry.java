package quest.gekko.giveaway.dto;

public record LeaderboardEntry(String participantId, String name, long score) {}
