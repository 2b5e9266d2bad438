package quest.gekko.giveaway.service.intake;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.giveaway.exception.NotAcceptingException;
import quest.gekko.giveaway.service.core.GiveawayService;
import quest.gekko.giveaway.service.scheduling.EventLoop;

/**
 * Turns platform-shaped cheer and subscription events into contributions.
 * Anonymous events cannot be attributed to anyone and are ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContributionIntake {
    private final GiveawayService giveaways;
    private final EventLoop loop;

    /** @return true if the cheer was counted */
    public boolean onBits(BitsEvent event) {
        if (event.anonymous() || isBlank(event.userId())) {
            log.debug("Ignoring unattributed cheer of {} bits", event.bits());
            return false;
        }
        if (event.bits() <= 0) return false;
        return submit(event.userId(), nameOf(event.displayName(), event.userName()), event.bits(), 0);
    }

    /** @return true if the gift was counted */
    public boolean onSubscription(SubscriptionEvent event) {
        if (!event.gift() || event.anonymous() || isBlank(event.gifterId())) {
            log.debug("Ignoring subscription that is not an attributable gift");
            return false;
        }
        return submit(event.gifterId(), nameOf(event.gifterDisplayName(), event.gifterName()), 0, 1);
    }

    private boolean submit(String participantId, String name, long bits, long subs) {
        return loop.call(() -> {
            try {
                giveaways.recordContribution(participantId, name, bits, subs);
                return true;
            } catch (NotAcceptingException | IllegalArgumentException e) {
                log.warn("Dropped contribution from {} (bits={}, subs={}): {}", participantId, bits, subs, e.getMessage());
                return false;
            }
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nameOf(String displayName, String userName) {
        return displayName != null && !displayName.isBlank() ? displayName : userName;
    }
}
