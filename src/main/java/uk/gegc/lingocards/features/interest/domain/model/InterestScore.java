package uk.gegc.lingocards.features.interest.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Current weight of one interest label for one learner.
 * <p>
 * The stored score is only refreshed when the label is touched; between touches it
 * decays geometrically by {@code decayRate} per elapsed day, see {@link #decayedScore(Instant)}.
 */
public record InterestScore(
        String label,
        double score,
        Instant lastUpdated,
        int interactionCount,
        double decayRate
) {

    public static final double DEFAULT_DECAY_RATE = 0.95;
    public static final double MAX_SCORE = 1.0;

    private static final double SECONDS_PER_DAY = 86_400.0;

    public InterestScore {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Interest label must not be blank");
        }
        if (Double.isNaN(score) || score < 0.0 || score > MAX_SCORE) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
        if (Double.isNaN(decayRate) || decayRate <= 0.0 || decayRate > 1.0) {
            throw new IllegalArgumentException("Decay rate must be in (0.0, 1.0], got " + decayRate);
        }
        if (interactionCount < 0) {
            throw new IllegalArgumentException("Interaction count must not be negative, got " + interactionCount);
        }
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    public static InterestScore initial(String label, Instant now, double decayRate) {
        return new InterestScore(label, 0.0, now, 0, decayRate);
    }

    /**
     * Score after applying {@code decayRate ^ elapsedDays}. A clock that runs behind
     * {@code lastUpdated} leaves the score unchanged, it never raises it.
     */
    public double decayedScore(Instant now) {
        double daysElapsed = Duration.between(lastUpdated, now).toMillis() / 1000.0 / SECONDS_PER_DAY;
        if (daysElapsed <= 0) {
            return score;
        }
        double decayed = score * Math.pow(decayRate, daysElapsed);
        return Math.max(0.0, decayed);
    }

    /**
     * Lazy decay, then add {@code weight}, clamped to {@link #MAX_SCORE}.
     */
    public InterestScore applyInteraction(double weight, Instant now) {
        if (Double.isNaN(weight) || weight < 0.0) {
            throw new IllegalArgumentException("Interaction weight must not be negative, got " + weight);
        }
        double updated = Math.min(MAX_SCORE, decayedScore(now) + weight);
        return new InterestScore(label, updated, now, interactionCount + 1, decayRate);
    }
}
