package quest.gekko.giveaway.service.broadcast;

import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import quest.gekko.giveaway.domain.ClientRole;
import quest.gekko.giveaway.event.ClientJoinedEvent;
import quest.gekko.giveaway.event.ClientLeftEvent;

import java.util.LinkedHashMap;
import java.util.Map;

/** Keeps control panels informed of how many displays of each role are attached. */
@Component
@RequiredArgsConstructor
public class PresenceNotifier {
    public static final String EVENT = "client-presence";

    private final BroadcastHub hub;

    @EventListener
    public void onJoined(ClientJoinedEvent event) {
        publish();
    }

    @EventListener
    public void onLeft(ClientLeftEvent event) {
        publish();
    }

    private void publish() {
        Map<String, Integer> payload = new LinkedHashMap<>();
        hub.roleCounts().forEach((role, count) -> payload.put(role.wireName(), count));
        hub.broadcastToRole(ClientRole.CONTROLS, EVENT, payload);
    }
}
