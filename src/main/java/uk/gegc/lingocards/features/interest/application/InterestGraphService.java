package uk.gegc.lingocards.features.interest.application;

import uk.gegc.lingocards.features.interest.domain.model.InterestAction;
import uk.gegc.lingocards.features.interest.domain.model.InterestGraph;
import uk.gegc.lingocards.features.interest.domain.model.InterestScore;

import java.util.UUID;

/**
 * Store for the weighted interest graph owned by each learner profile.
 */
public interface InterestGraphService {

    /**
     * Records one interaction of the learner with {@code label}.
     *
     * @param actionType one of {@code click, view_50_percent, view_100_percent, share, explicit_tag}
     * @return the label's score after the interaction
     * @throws IllegalArgumentException for an unknown action type or a blank label; nothing is written
     * @throws uk.gegc.lingocards.shared.exception.ResourceNotFoundException if the user has no profile
     */
    InterestScore recordInteraction(UUID userId, String label, String actionType);

    /**
     * Single read-modify-write of the whole graph. Fails with
     * {@link org.springframework.dao.OptimisticLockingFailureException} when another
     * request rewrote the graph in the meantime.
     */
    InterestScore applyInteraction(UUID userId, String label, InterestAction action);

    InterestGraph getGraph(UUID userId);

    /**
     * Label with the highest stored score, or the configured default interest
     * ({@code lingocards.personalization.default-interest}) for an empty graph,
     * an anonymous caller or a user without a profile.
     */
    String topInterest(UUID userId);
}
