package quest.gekko.giveaway.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.giveaway.config.OverlayProperties;
import quest.gekko.giveaway.domain.ClientRole;
import quest.gekko.giveaway.event.ClientJoinedEvent;
import quest.gekko.giveaway.event.OwnerAuthorizedEvent;
import quest.gekko.giveaway.event.OwnerDeauthorizedEvent;
import quest.gekko.giveaway.service.broadcast.RecordingClientConnection;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OwnerSessionTest {

    private final List<Object> published = new ArrayList<>();
    private GiveawayFixture fx;
    private RecordingClientConnection controls;

    @BeforeEach
    void setUp() {
        fx = new GiveawayFixture();
        controls = fx.join("controls-1", ClientRole.CONTROLS);
        controls.clear();
    }

    private OwnerSession session(String configuredOwner) {
        return new OwnerSession(fx.loop, fx.hub, published::add, new OverlayProperties.Owner(configuredOwner));
    }

    @Test
    void configuredOwnerIsAuthorizedAtStartup() {
        OwnerSession session = session("1234");

        session.run(null);

        assertThat(session.currentOwner()).contains("1234");
        assertThat(published).containsExactly(new OwnerAuthorizedEvent("1234"));
        assertThat(controls.last(OwnerSession.AUTH_EVENT).path("authorized").asBoolean()).isTrue();
    }

    @Test
    void blankConfiguredOwnerLeavesSessionEmpty() {
        OwnerSession session = session(" ");

        session.run(null);

        assertThat(session.currentOwner()).isEmpty();
        assertThat(published).isEmpty();
    }

    @Test
    void reauthorizingSameOwnerIsNoOp() {
        OwnerSession session = session(null);
        session.authorize("1234");
        session.authorize("1234");

        assertThat(published).hasSize(1);
    }

    @Test
    void switchingOwnersDeauthorizesPreviousFirst() {
        OwnerSession session = session(null);
        session.authorize("1234");
        session.authorize("5678");

        assertThat(published).containsExactly(
                new OwnerAuthorizedEvent("1234"),
                new OwnerDeauthorizedEvent("1234"),
                new OwnerAuthorizedEvent("5678"));
    }

    @Test
    void deauthorizeClearsOwnerAndAnnouncesIt() {
        OwnerSession session = session(null);
        session.authorize("1234");
        session.deauthorize();
        session.deauthorize();

        assertThat(session.currentOwner()).isEmpty();
        assertThat(published).containsExactly(new OwnerAuthorizedEvent("1234"), new OwnerDeauthorizedEvent("1234"));
        assertThat(controls.last(OwnerSession.AUTH_EVENT).path("authorized").asBoolean()).isFalse();
    }

    @Test
    void blankOwnerIsRejected() {
        assertThatThrownBy(() -> session(null).authorize("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void joiningClientIsToldTheAuthState() {
        OwnerSession session = session(null);
        session.authorize("1234");
        RecordingClientConnection late = new RecordingClientConnection("late");

        session.onClientJoined(new ClientJoinedEvent(late, ClientRole.RESULTS));

        assertThat(late.last(OwnerSession.AUTH_EVENT).path("ownerId").asText()).isEqualTo("1234");
    }
}
