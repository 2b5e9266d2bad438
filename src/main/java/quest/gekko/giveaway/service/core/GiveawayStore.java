package quest.gekko.giveaway.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import quest.gekko.giveaway.domain.Contribution;
import quest.gekko.giveaway.domain.Giveaway;
import quest.gekko.giveaway.domain.OverlayPosition;
import quest.gekko.giveaway.exception.StoreWriteException;
import quest.gekko.giveaway.repository.ContributionRepository;
import quest.gekko.giveaway.repository.GiveawayRepository;
import quest.gekko.giveaway.repository.OverlayPositionRepository;

import java.util.List;
import java.util.Optional;

/**
 * Checkpoint target for the in-memory giveaway and tallies. Writes other than the
 * initial insert report failure instead of throwing; callers keep going with their
 * in-memory copy and the next write retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GiveawayStore {
    private final GiveawayRepository giveawayRepository;
    private final ContributionRepository contributionRepository;
    private final OverlayPositionRepository overlayPositionRepository;

    public Giveaway create(Giveaway giveaway) {
        try {
            giveawayRepository.save(giveaway);
            return giveaway;
        } catch (DataAccessException e) {
            throw new StoreWriteException("Could not create giveaway for " + giveaway.getOwnerId(), e);
        }
    }

    public boolean checkpoint(Giveaway giveaway) {
        try {
            giveawayRepository.save(giveaway);
            return true;
        } catch (DataAccessException e) {
            log.warn("Checkpoint of giveaway {} failed: {}", giveaway.getId(), e.getMessage());
            return false;
        }
    }

    public boolean saveContribution(Contribution contribution) {
        try {
            contributionRepository.save(contribution);
            return true;
        } catch (DataAccessException e) {
            log.warn("Write of contribution {}/{} failed: {}",
                    contribution.getGiveawayId(), contribution.getParticipantId(), e.getMessage());
            return false;
        }
    }

    public Optional<Giveaway> findRecoverable(String ownerId) {
        return giveawayRepository.findFirstByOwnerIdAndCancelledFalseAndEndTimeIsNullOrderByStartTimeDescIdDesc(ownerId);
    }

    public List<Contribution> loadContributions(Long giveawayId) {
        return contributionRepository.findByGiveawayIdOrderByIdAsc(giveawayId);
    }

    public List<OverlayPosition> overlayPositions() {
        return overlayPositionRepository.findAllByOrderByNameAsc();
    }

    public boolean moveOverlay(String name, double x, double y) {
        try {
            OverlayPosition position = overlayPositionRepository.findById(name).orElseGet(() -> {
                OverlayPosition p = new OverlayPosition();
                p.setName(name);
                return p;
            });
            position.setX(x);
            position.setY(y);
            overlayPositionRepository.save(position);
            return true;
        } catch (DataAccessException e) {
            log.warn("Could not store position of overlay {}: {}", name, e.getMessage());
            return false;
        }
    }
}
