package uk.gegc.lingocards.features.ai.application;

import lombok.Builder;
import uk.gegc.lingocards.features.vocabulary.domain.model.CefrLevel;

import java.util.List;

/**
 * Canonical shape of one generated word explanation. {@code usages} always holds
 * exactly three entries; {@code conversationalExample} and {@code gender} may be null.
 */
@Builder
public record GeneratedContent(
        String inputWord,
        String definition,
        String conversationalExample,
        List<String> usages,
        CefrLevel resolvedLevel,
        String resolvedTargetLanguage,
        String nativeLanguage,
        String partOfSpeech,
        String baseForm,
        String gender,
        String selectedInterest
) {

    public GeneratedContent {
        usages = usages == null ? List.of() : List.copyOf(usages);
    }
}
