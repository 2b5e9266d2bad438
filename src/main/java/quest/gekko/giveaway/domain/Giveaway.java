package quest.gekko.giveaway.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single time-boxed giveaway. Once cancelled or out of time the record is
 * terminal and every mutator below refuses to touch it.
 */
@Entity
@Table(name = "giveaway", indexes = @Index(name = "ix_giveaway_owner_start", columnList = "owner_id,start_time"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Giveaway {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(nullable = false)
    private long duration;

    @Column(name = "elapsed_time", nullable = false)
    private long elapsedTime;

    @Column(nullable = false)
    private boolean paused;

    @Column(nullable = false)
    private boolean cancelled;

    public static Giveaway begin(String ownerId, long durationMs, Instant now) {
        if (ownerId == null || ownerId.isBlank()) throw new IllegalArgumentException("ownerId is required");
        if (durationMs <= 0) throw new IllegalArgumentException("duration must be > 0");

        Giveaway giveaway = new Giveaway();
        giveaway.ownerId = ownerId;
        giveaway.startTime = now;
        giveaway.duration = durationMs;
        return giveaway;
    }

    public long remaining() {
        return Math.max(0, duration - elapsedTime);
    }

    public boolean isExpired() {
        return elapsedTime >= duration;
    }

    public boolean isTerminal() {
        return cancelled || endTime != null || isExpired();
    }

    public GiveawayState state() {
        if (cancelled) return GiveawayState.CANCELLED;
        if (endTime != null || isExpired()) return GiveawayState.ENDED;
        return paused ? GiveawayState.PAUSED : GiveawayState.RUNNING;
    }

    /** Adds wall-clock progress; negative deltas (clock steps backwards) are ignored. */
    public void advance(long deltaMs) {
        requireLive();
        if (deltaMs <= 0) return;
        elapsedTime = Math.min(duration, elapsedTime + deltaMs);
    }

    public void pause() {
        requireLive();
        paused = true;
    }

    public void resume() {
        requireLive();
        paused = false;
    }

    public void cancel(Instant now) {
        requireLive();
        cancelled = true;
        endTime = now;
    }

    public void finish(Instant now) {
        if (cancelled || endTime != null) throw new IllegalStateException("Giveaway " + id + " is already terminal");
        elapsedTime = duration;
        endTime = now;
    }

    private void requireLive() {
        if (isTerminal()) throw new IllegalStateException("Giveaway " + id + " is terminal");
    }
}
