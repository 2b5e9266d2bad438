package quest.gekko.giveaway.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.giveaway.domain.Giveaway;

import java.util.Optional;

public interface GiveawayRepository extends JpaRepository<Giveaway, Long> {

    // Most recent giveaway for the owner that was neither cancelled nor finished
    Optional<Giveaway> findFirstByOwnerIdAndCancelledFalseAndEndTimeIsNullOrderByStartTimeDescIdDesc(final String ownerId);
}
