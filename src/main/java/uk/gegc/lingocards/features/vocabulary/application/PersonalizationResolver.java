package uk.gegc.lingocards.features.vocabulary.application;

import java.util.UUID;

public interface PersonalizationResolver {

    /**
     * Returns a personalized content card for {@code wordText}, reusing a cached card when
     * one matches the learner's key and generating one otherwise. Generation failures
     * yield a persisted placeholder card instead of an error.
     *
     * @param userId   the learner, or null for an anonymous lookup with default preferences
     * @param wordText raw word text; trimmed and lower-cased before use
     * @throws IllegalArgumentException if {@code wordText} is null or blank
     * @throws uk.gegc.lingocards.shared.exception.ResourceNotFoundException for an unknown user
     */
    WordLookupResult fetchWordContent(UUID userId, String wordText);
}
