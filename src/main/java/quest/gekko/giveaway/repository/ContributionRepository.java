package quest.gekko.giveaway.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.giveaway.domain.Contribution;

import java.util.List;

public interface ContributionRepository extends JpaRepository<Contribution, Long> {
    List<Contribution> findByGiveawayIdOrderByIdAsc(final Long giveawayId);
}
