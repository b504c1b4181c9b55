package uk.gegc.lingocards.features.ai.application;

/**
 * Produces a personalized explanation for a word. Invoked only when no cached
 * content card matches the learner's personalization key.
 */
public interface ContentGenerationGateway {

    /**
     * @throws uk.gegc.lingocards.shared.exception.ContentGenerationException on timeout or provider error
     * @throws uk.gegc.lingocards.shared.exception.AIResponseParseException when the response is malformed
     *         or fails validation
     */
    GeneratedContent generate(GenerationRequest request);
}
