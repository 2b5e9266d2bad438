package quest.gekko.giveaway.service.broadcast;

import com.fasterxml.jackson.databind.JsonNode;

public record InboundMessage(String event, JsonNode data) {}
