package uk.gegc.lingocards.features.vocabulary.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Personalization key under which a generated explanation is reused.
 * Matching is exact on all five parts.
 */
public record ContentCardKey(
        UUID wordId,
        String targetLanguage,
        CefrLevel cefrLevel,
        String interestContext,
        String toneStyle
) {

    public ContentCardKey {
        Objects.requireNonNull(wordId, "wordId");
        Objects.requireNonNull(targetLanguage, "targetLanguage");
        Objects.requireNonNull(cefrLevel, "cefrLevel");
        Objects.requireNonNull(interestContext, "interestContext");
        Objects.requireNonNull(toneStyle, "toneStyle");
    }

    public static ContentCardKey of(ContentCard card) {
        return new ContentCardKey(
                card.getWord().getId(),
                card.getTargetLanguage(),
                card.getTargetCefr(),
                card.getInterestContext(),
                card.getToneStyle()
        );
    }
}
