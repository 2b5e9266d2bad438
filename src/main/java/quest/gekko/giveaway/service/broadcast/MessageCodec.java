package quest.gekko.giveaway.service.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Wire format for client frames: {@code {"event": name, "data": payload}}.
 */
@Component
@RequiredArgsConstructor
public class MessageCodec {
    private final ObjectMapper objectMapper;

    public String encode(String event, Object data) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("event", event);
        frame.set("data", objectMapper.valueToTree(data));
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to encode " + event, e);
        }
    }

    /** Empty when the frame is not JSON or has no event name. */
    public Optional<InboundMessage> decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null || !root.path("event").isTextual()) return Optional.empty();

        JsonNode data = root.has("data") ? root.get("data") : NullNode.getInstance();
        return Optional.of(new InboundMessage(root.get("event").asText(), data));
    }

    public <T> T read(JsonNode data, Class<T> type) {
        try {
            return objectMapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " payload", e);
        }
    }
}
