package uk.gegc.lingocards.features.ai.application;

/**
 * Service for building prompts for personalized word explanations
 */
public interface PromptTemplateService {

    String buildSystemPrompt();

    String buildWordLookupPrompt(GenerationRequest request);
}
