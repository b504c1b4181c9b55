package uk.gegc.lingocards.features.vocabulary.application;

import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCard;
import uk.gegc.lingocards.features.vocabulary.domain.model.VocabularyMembership;

/**
 * Outcome of a word lookup.
 *
 * @param membership the learner's link to {@code card}; null for anonymous lookups
 * @param cacheHit   whether an existing card was reused without calling the generator
 * @param generated  whether the card holds generated content rather than the fallback placeholder
 */
public record WordLookupResult(
        ContentCard card,
        VocabularyMembership membership,
        boolean cacheHit,
        boolean generated
) {
}
