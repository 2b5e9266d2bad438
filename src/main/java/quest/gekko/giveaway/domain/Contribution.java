package quest.gekko.giveaway.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Running tally of what one participant has given to one giveaway. Counts only ever grow.
 */
@Entity
@Table(name = "contribution",
        uniqueConstraints = @UniqueConstraint(name = "uk_contribution_participant", columnNames = { "giveaway_id", "participant_id" }))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Contribution {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "giveaway_id", nullable = false)
    private Long giveawayId;

    @Column(name = "participant_id", nullable = false)
    private String participantId;

    @Column(name = "display_name")
    private String displayName;

    @Column(nullable = false)
    private long bits;

    @Column(nullable = false)
    private long subs;

    public Contribution(Long giveawayId, String participantId, String displayName) {
        this.giveawayId = giveawayId;
        this.participantId = participantId;
        this.displayName = displayName;
    }

    public void add(long bitsDelta, long subsDelta) {
        if (bitsDelta < 0 || subsDelta < 0) {
            throw new IllegalArgumentException("Contribution deltas must be >= 0 (bits=" + bitsDelta + ", subs=" + subsDelta + ")");
        }
        bits += bitsDelta;
        subs += subsDelta;
    }

    public void rename(String name) {
        if (name != null && !name.isBlank()) displayName = name;
    }

    public String nameForDisplay() {
        return displayName != null ? displayName : participantId;
    }
}
