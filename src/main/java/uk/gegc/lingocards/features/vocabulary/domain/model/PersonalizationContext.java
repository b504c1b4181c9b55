package uk.gegc.lingocards.features.vocabulary.domain.model;

import java.util.List;
import java.util.UUID;

/**
 * Everything personalization needs about the learner, resolved once per lookup
 * with defaults already applied. {@code userId} is null for anonymous lookups.
 */
public record PersonalizationContext(
        UUID userId,
        String targetLanguage,
        String nativeLanguage,
        CefrLevel cefrLevel,
        String interestContext,
        String toneStyle,
        String ageGroup,
        List<String> candidateInterests
) {

    public PersonalizationContext {
        candidateInterests = candidateInterests == null ? List.of() : List.copyOf(candidateInterests);
    }

    public boolean isAnonymous() {
        return userId == null;
    }

    public ContentCardKey cacheKeyFor(Word word) {
        return new ContentCardKey(word.getId(), targetLanguage, cefrLevel, interestContext, toneStyle);
    }
}
