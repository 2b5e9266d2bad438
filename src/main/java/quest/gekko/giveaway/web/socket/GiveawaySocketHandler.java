package quest.gekko.giveaway.web.socket;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import quest.gekko.giveaway.domain.ClientRole;
import quest.gekko.giveaway.dto.OverlayPositionDTO;
import quest.gekko.giveaway.service.broadcast.BroadcastHub;
import quest.gekko.giveaway.service.broadcast.ClientConnection;
import quest.gekko.giveaway.service.broadcast.InboundMessage;
import quest.gekko.giveaway.service.broadcast.MessageCodec;
import quest.gekko.giveaway.service.core.GiveawayStore;
import quest.gekko.giveaway.service.scheduling.EventLoop;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bridges websocket sessions onto the event loop. Session callbacks arrive on
 * container threads; everything past the frame decode runs on the loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GiveawaySocketHandler extends TextWebSocketHandler {
    public static final String ROLE_EVENT = "client-role";
    public static final String DRAG_EVENT = "overlay-drag";
    public static final String MOVED_EVENT = "overlay-moved";

    private final BroadcastHub hub;
    private final MessageCodec codec;
    private final EventLoop loop;
    private final GiveawayStore store;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ClientConnection client = new WebSocketClientConnection(session);
        connections.put(session.getId(), client);
        loop.execute(() -> hub.connect(client));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection client = connections.get(session.getId());
        if (client == null) return;

        codec.decode(message.getPayload()).ifPresentOrElse(
                inbound -> loop.execute(() -> dispatch(client, inbound)),
                () -> log.debug("Ignoring malformed frame from {}", session.getId()));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection client = connections.remove(session.getId());
        if (client != null) loop.execute(() -> hub.disconnect(client));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on {}: {}", session.getId(), exception.getMessage());
    }

    void dispatch(ClientConnection client, InboundMessage message) {
        switch (message.event()) {
            case ROLE_EVENT -> announce(client, message.data());
            case DRAG_EVENT -> moveOverlay(client, message.data());
            default -> log.debug("Ignoring unknown event {} from {}", message.event(), client.id());
        }
    }

    private void announce(ClientConnection client, JsonNode data) {
        String requested = data.isTextual() ? data.asText() : data.path("role").asText(null);
        ClientRole.fromWire(requested).ifPresentOrElse(
                role -> hub.announce(client, role),
                () -> log.warn("Client {} announced unknown role '{}'", client.id(), requested));
    }

    private void moveOverlay(ClientConnection client, JsonNode data) {
        if (!hub.isAdmitted(client)) return;
        OverlayPositionDTO position;
        try {
            position = codec.read(data, OverlayPositionDTO.class);
        } catch (IllegalArgumentException e) {
            log.warn("Bad overlay-drag from {}: {}", client.id(), e.getMessage());
            return;
        }
        if (position.name() == null || position.name().isBlank()) return;

        hub.broadcast(MOVED_EVENT, position);
        store.moveOverlay(position.name(), position.x(), position.y());
    }
}
