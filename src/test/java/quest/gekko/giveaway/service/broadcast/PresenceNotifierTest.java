package quest.gekko.giveaway.service.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.giveaway.domain.ClientRole;
import quest.gekko.giveaway.event.ClientJoinedEvent;
import quest.gekko.giveaway.event.ClientLeftEvent;

import static org.assertj.core.api.Assertions.assertThat;

class PresenceNotifierTest {

    private BroadcastHub hub;
    private PresenceNotifier notifier;

    @BeforeEach
    void setUp() {
        hub = new BroadcastHub(new MessageCodec(JsonMapper.builder().findAndAddModules().build()), event -> {
            if (event instanceof ClientJoinedEvent joined) notifier.onJoined(joined);
            if (event instanceof ClientLeftEvent left) notifier.onLeft(left);
        });
        notifier = new PresenceNotifier(hub);
    }

    @Test
    void controlsSeeCountsOnJoinAndLeave() {
        RecordingClientConnection controls = admit("c1", ClientRole.CONTROLS);
        RecordingClientConnection overlay = admit("o1", ClientRole.OVERLAY);

        JsonNode counts = controls.last(PresenceNotifier.EVENT);
        assertThat(counts.path("overlay").asInt()).isEqualTo(1);
        assertThat(counts.path("controls").asInt()).isEqualTo(1);
        assertThat(counts.path("results").asInt()).isZero();
        assertThat(overlay.messages(PresenceNotifier.EVENT)).isEmpty();

        hub.disconnect(overlay);
        assertThat(controls.last(PresenceNotifier.EVENT).path("overlay").asInt()).isZero();
    }

    private RecordingClientConnection admit(String id, ClientRole role) {
        RecordingClientConnection client = new RecordingClientConnection(id);
        hub.connect(client);
        hub.announce(client, role);
        return client;
    }
}
