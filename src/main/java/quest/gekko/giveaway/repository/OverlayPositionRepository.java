package quest.gekko.giveaway.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.giveaway.domain.OverlayPosition;

import java.util.List;

public interface OverlayPositionRepository extends JpaRepository<OverlayPosition, String> {
    List<OverlayPosition> findAllByOrderByNameAsc();
}
