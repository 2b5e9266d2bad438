package quest.gekko.giveaway.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "overlay_position")
@Getter @Setter
public class OverlayPosition {
    @Id
    @Column(length = 64)
    String name;

    @Column(nullable = false)
    double x;

    @Column(nullable = false)
    double y;
}
