package quest.gekko.giveaway.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import quest.gekko.giveaway.domain.Giveaway;
import quest.gekko.giveaway.domain.GiveawayState;
import quest.gekko.giveaway.event.OwnerAuthorizedEvent;
import quest.gekko.giveaway.service.scheduling.EventLoop;

import java.util.Optional;

/**
 * Picks up the unfinished giveaway of a freshly authorized owner after a restart
 * or a re-login. The recovered giveaway is always paused.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryService {
    private final GiveawayStore store;
    private final GiveawayService giveaways;
    private final EventLoop loop;

    @EventListener
    public void onOwnerAuthorized(OwnerAuthorizedEvent event) {
        loop.run(() -> recover(event.ownerId()));
    }

    public Optional<Giveaway> recover(String ownerId) {
        if (giveaways.state() != GiveawayState.IDLE) {
            log.debug("Skipping recovery for {}: a giveaway is already loaded", ownerId);
            return Optional.empty();
        }

        Optional<Giveaway> found = store.findRecoverable(ownerId);
        if (found.isEmpty()) {
            log.info("No unfinished giveaway for {}", ownerId);
            return Optional.empty();
        }

        Giveaway giveaway = found.get();
        if (giveaway.isExpired()) {
            log.info("Giveaway {} ran out of time before shutdown; leaving it as is", giveaway.getId());
            return Optional.empty();
        }

        giveaways.adoptRecovered(giveaway, store.loadContributions(giveaway.getId()));
        return found;
    }
}
