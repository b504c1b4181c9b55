package uk.gegc.lingocards.features.vocabulary.application;

import uk.gegc.lingocards.features.vocabulary.domain.model.VocabularyMembership;

import java.util.List;
import java.util.UUID;

/**
 * A learner's saved words.
 */
public interface VocabularyService {

    /**
     * Newest first. A null {@code familiarity} lists everything.
     */
    List<VocabularyMembership> listForUser(UUID userId, Integer familiarity);

    VocabularyMembership updateFamiliarity(UUID userId, UUID membershipId, int familiarity);

    /**
     * Removes the word from the learner's list. The shared content card stays cached.
     */
    void remove(UUID userId, UUID membershipId);
}
