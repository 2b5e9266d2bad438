package quest.gekko.giveaway.dto;

public record CommandAck(boolean success) {
    public static CommandAck ok() { return new CommandAck(true); }
    public static CommandAck failed() { return new CommandAck(false); }
}
