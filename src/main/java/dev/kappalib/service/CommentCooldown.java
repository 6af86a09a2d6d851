package dev.kappalib.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-profile comment cooldown. Process-local; a restart forgets all entries.
 */
@Component
@Slf4j
public class CommentCooldown {

    public static final Duration COOLDOWN = Duration.ofSeconds(30);
    static final Duration RETENTION = Duration.ofMinutes(5);

    private final Map<String, Instant> lastSubmission = new ConcurrentHashMap<>();
    private final Clock clock;

    public CommentCooldown(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return time left before the profile may comment again, {@link Duration#ZERO} when allowed
     */
    public Duration remaining(String profileId) {
        Instant last = profileId == null ? null : lastSubmission.get(profileId);
        if (last == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(last, clock.instant());
        return elapsed.compareTo(COOLDOWN) >= 0 ? Duration.ZERO : COOLDOWN.minus(elapsed);
    }

    /**
     * Atomically claims the cooldown slot for a new submission. Of two concurrent callers
     * for the same profile only one is granted.
     */
    public Reservation tryReserve(String profileId) {
        Instant now = clock.instant();
        if (profileId == null) {
            // Anonymous requests fail authentication later and never hold a slot
            return new Reservation(null, now, Duration.ZERO);
        }
        Duration[] wait = {Duration.ZERO};
        lastSubmission.compute(profileId, (id, last) -> {
            if (last != null) {
                Duration elapsed = Duration.between(last, now);
                if (elapsed.compareTo(COOLDOWN) < 0) {
                    wait[0] = COOLDOWN.minus(elapsed);
                    return last;
                }
            }
            return now;
        });
        return new Reservation(profileId, now, wait[0]);
    }

    /**
     * Drops a granted reservation whose submission was not stored. A newer entry is left in place.
     */
    public void release(Reservation reservation) {
        if (reservation.granted() && reservation.profileId() != null) {
            lastSubmission.remove(reservation.profileId(), reservation.at());
        }
    }

    public record Reservation(String profileId, Instant at, Duration retryAfter) {

        public boolean granted() {
            return retryAfter.isZero();
        }
    }

    public boolean isAllowed(String profileId) {
        return remaining(profileId).isZero();
    }

    @Scheduled(fixedRate = 300_000, initialDelay = 300_000)
    public void sweep() {
        Instant cutoff = clock.instant().minus(RETENTION);
        int before = lastSubmission.size();
        lastSubmission.values().removeIf(last -> last.isBefore(cutoff));
        int removed = before - lastSubmission.size();
        if (removed > 0) {
            log.debug("Comment cooldown sweep removed {} entries", removed);
        }
    }

    int size() {
        return lastSubmission.size();
    }
}
