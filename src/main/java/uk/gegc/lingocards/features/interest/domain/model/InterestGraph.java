package uk.gegc.lingocards.features.interest.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory form of a learner's weighted interest graph, keyed by label.
 * Rebuilt from the persisted document on every read and written back whole.
 */
public final class InterestGraph {

    private static final Comparator<InterestScore> BY_LABEL = Comparator.comparing(InterestScore::label);

    private final Map<String, InterestScore> scores;

    private InterestGraph(Map<String, InterestScore> scores) {
        this.scores = scores;
    }

    public static InterestGraph empty() {
        return new InterestGraph(new LinkedHashMap<>());
    }

    public static InterestGraph of(Map<String, InterestScore> scores) {
        return new InterestGraph(new LinkedHashMap<>(scores));
    }

    public Optional<InterestScore> get(String label) {
        return Optional.ofNullable(scores.get(label));
    }

    /**
     * Applies one interaction to {@code label}: lazy decay of the stored score,
     * the action weight added on top, result capped at 1.0. Unknown labels start at 0.0.
     */
    public InterestScore recordInteraction(String label, InterestAction action, Instant now, double decayRateForNewLabels) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Interest label must not be blank");
        }
        InterestScore current = scores.get(label);
        if (current == null) {
            current = InterestScore.initial(label, now, decayRateForNewLabels);
        }
        InterestScore updated = current.applyInteraction(action.getWeight(), now);
        scores.put(label, updated);
        return updated;
    }

    /**
     * Label with the highest stored score. Stored scores are not decayed before
     * ranking; ties go to the alphabetically first label.
     */
    public Optional<String> topInterest() {
        return scores.values().stream()
                .max(Comparator.comparingDouble(InterestScore::score).thenComparing(BY_LABEL.reversed()))
                .map(InterestScore::label);
    }

    /**
     * Scores ordered by their decayed value at {@code now}, highest first.
     */
    public List<InterestScore> rankedByDecayedScore(Instant now) {
        return scores.values().stream()
                .sorted(Comparator.comparingDouble((InterestScore s) -> s.decayedScore(now)).reversed()
                        .thenComparing(BY_LABEL))
                .toList();
    }

    public Map<String, InterestScore> asMap() {
        return Collections.unmodifiableMap(scores);
    }

    public int size() {
        return scores.size();
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }
}
