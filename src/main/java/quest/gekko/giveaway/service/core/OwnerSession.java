package quest.gekko.giveaway.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import quest.gekko.giveaway.config.OverlayProperties;
import quest.gekko.giveaway.dto.AuthStateDTO;
import quest.gekko.giveaway.event.ClientJoinedEvent;
import quest.gekko.giveaway.event.OwnerAuthorizedEvent;
import quest.gekko.giveaway.event.OwnerDeauthorizedEvent;
import quest.gekko.giveaway.service.broadcast.BroadcastHub;
import quest.gekko.giveaway.service.scheduling.EventLoop;

import java.util.Optional;

/**
 * Tracks which channel owner the overlay is working for. Authorizing an owner
 * triggers recovery of their unfinished giveaway; deauthorizing suspends it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OwnerSession implements ApplicationRunner {
    public static final String AUTH_EVENT = "auth-state";

    private final EventLoop loop;
    private final BroadcastHub hub;
    private final ApplicationEventPublisher events;
    private final OverlayProperties.Owner owner;

    private String ownerId;

    @Override
    public void run(ApplicationArguments args) {
        if (owner.id() != null && !owner.id().isBlank()) {
            authorize(owner.id());
        } else {
            log.info("No owner configured; waiting for authorization");
        }
    }

    public Optional<String> currentOwner() {
        return loop.call(() -> Optional.ofNullable(ownerId));
    }

    public void authorize(String newOwnerId) {
        if (newOwnerId == null || newOwnerId.isBlank()) throw new IllegalArgumentException("ownerId is required");
        loop.run(() -> {
            if (newOwnerId.equals(ownerId)) return;
            if (ownerId != null) deauthorizeOnLoop();

            ownerId = newOwnerId;
            log.info("Owner {} authorized", newOwnerId);
            hub.broadcast(AUTH_EVENT, authState());
            events.publishEvent(new OwnerAuthorizedEvent(newOwnerId));
        });
    }

    public void deauthorize() {
        loop.run(this::deauthorizeOnLoop);
    }

    @Order(0)
    @EventListener
    public void onClientJoined(ClientJoinedEvent event) {
        hub.sendTo(event.client(), AUTH_EVENT, authState());
    }

    private void deauthorizeOnLoop() {
        if (ownerId == null) return;
        String previous = ownerId;
        ownerId = null;
        log.info("Owner {} deauthorized", previous);
        hub.broadcast(AUTH_EVENT, authState());
        events.publishEvent(new OwnerDeauthorizedEvent(previous));
    }

    private AuthStateDTO authState() {
        return new AuthStateDTO(ownerId != null, ownerId);
    }
}
