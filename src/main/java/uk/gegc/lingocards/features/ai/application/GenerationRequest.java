package uk.gegc.lingocards.features.ai.application;

import uk.gegc.lingocards.features.vocabulary.domain.model.PersonalizationContext;

import java.util.Objects;

public record GenerationRequest(String wordText, PersonalizationContext context) {

    public GenerationRequest {
        Objects.requireNonNull(context, "context");
        if (wordText == null || wordText.isBlank()) {
            throw new IllegalArgumentException("Word text cannot be empty");
        }
    }
}
