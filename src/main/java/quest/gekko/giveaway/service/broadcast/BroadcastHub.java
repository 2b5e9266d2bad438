package quest.gekko.giveaway.service.broadcast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import quest.gekko.giveaway.domain.ClientRole;
import quest.gekko.giveaway.event.ClientJoinedEvent;
import quest.gekko.giveaway.event.ClientLeftEvent;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of connected clients and the single fan-out point for outbound frames.
 * A connection is inert until it announces a role; only then is it admitted to
 * the broadcast set and its role bucket. All methods run on the event loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastHub {
    private final MessageCodec codec;
    private final ApplicationEventPublisher events;

    private final Map<String, ClientConnection> pending = new LinkedHashMap<>();
    private final Map<String, ClientConnection> admitted = new LinkedHashMap<>();
    private final Map<ClientRole, Set<ClientConnection>> byRole = new EnumMap<>(ClientRole.class);

    public void connect(ClientConnection client) {
        pending.put(client.id(), client);
        log.debug("Client {} connected, awaiting role", client.id());
    }

    /**
     * Admits a pending client under the given role and notifies listeners so they
     * can push their snapshot to it. Returns false if the client is unknown or
     * already admitted.
     */
    public boolean announce(ClientConnection client, ClientRole role) {
        if (admitted.containsKey(client.id())) {
            log.debug("Client {} already announced, ignoring {}", client.id(), role.wireName());
            return false;
        }
        if (pending.remove(client.id()) == null) return false;

        admitted.put(client.id(), client);
        byRole.computeIfAbsent(role, r -> new LinkedHashSet<>()).add(client);
        log.info("Client {} joined as {}", client.id(), role.wireName());
        events.publishEvent(new ClientJoinedEvent(client, role));
        return true;
    }

    public void disconnect(ClientConnection client) {
        pending.remove(client.id());
        boolean wasAdmitted = admitted.remove(client.id()) != null;

        List<ClientRole> left = new ArrayList<>();
        for (Map.Entry<ClientRole, Set<ClientConnection>> bucket : byRole.entrySet()) {
            if (bucket.getValue().remove(client)) left.add(bucket.getKey());
        }
        if (wasAdmitted) log.info("Client {} left", client.id());
        for (ClientRole role : left) {
            events.publishEvent(new ClientLeftEvent(client, role));
        }
    }

    public void broadcast(String event, Object data) {
        fanOut(List.copyOf(admitted.values()), event, data);
    }

    public void broadcastToRole(ClientRole role, String event, Object data) {
        fanOut(List.copyOf(byRole.getOrDefault(role, Set.of())), event, data);
    }

    public void sendTo(ClientConnection client, String event, Object data) {
        deliver(client, codec.encode(event, data));
    }

    public boolean isAdmitted(ClientConnection client) {
        return admitted.containsKey(client.id());
    }

    public int clientCount() {
        return admitted.size();
    }

    public Map<ClientRole, Integer> roleCounts() {
        Map<ClientRole, Integer> counts = new EnumMap<>(ClientRole.class);
        for (ClientRole role : ClientRole.values()) {
            counts.put(role, byRole.getOrDefault(role, Set.of()).size());
        }
        return counts;
    }

    private void fanOut(List<ClientConnection> targets, String event, Object data) {
        if (targets.isEmpty()) return;
        String frame = codec.encode(event, data);
        for (ClientConnection client : targets) {
            deliver(client, frame);
        }
    }

    private void deliver(ClientConnection client, String frame) {
        if (!client.isOpen()) {
            disconnect(client);
            return;
        }
        try {
            client.send(frame);
        } catch (IOException | RuntimeException e) {
            log.warn("Dropping client {} after failed send: {}", client.id(), e.getMessage());
            disconnect(client);
            client.close();
        }
    }
}
