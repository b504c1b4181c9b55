package uk.gegc.lingocards.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.lingocards.features.ai.application.GenerationRequest;
import uk.gegc.lingocards.features.ai.application.PromptTemplateService;
import uk.gegc.lingocards.features.vocabulary.domain.model.PersonalizationContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds word lookup prompts from the templates under {@code classpath:prompts/}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromptTemplateServiceImpl implements PromptTemplateService {

    static final String SYSTEM_TEMPLATE = "system/word-tutor.txt";
    static final String LOOKUP_TEMPLATE = "word-lookup/personalized-explanation.txt";

    private static final Map<String, String> LANGUAGE_NAMES = Map.of(
            "fr", "French",
            "en", "English",
            "es", "Spanish",
            "de", "German",
            "it", "Italian",
            "pt", "Portuguese",
            "zh", "Chinese",
            "ja", "Japanese",
            "ko", "Korean"
    );

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String buildSystemPrompt() {
        try {
            return loadPromptTemplate(SYSTEM_TEMPLATE);
        } catch (Exception e) {
            log.warn("Falling back to inline system prompt: {}", e.getMessage());
            return "You are a personalized language tutor. Reply with a single JSON object only, no markdown.";
        }
    }

    @Override
    public String buildWordLookupPrompt(GenerationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Generation request cannot be null");
        }
        PersonalizationContext context = request.context();
        String interests = context.candidateInterests().isEmpty()
                ? context.interestContext()
                : String.join(", ", context.candidateInterests());

        Map<String, String> values = Map.ofEntries(
                Map.entry("{word}", request.wordText()),
                Map.entry("{targetLanguage}", context.targetLanguage()),
                Map.entry("{nativeLanguage}", context.nativeLanguage()),
                Map.entry("{targetLanguageName}", languageName(context.targetLanguage())),
                Map.entry("{nativeLanguageName}", languageName(context.nativeLanguage())),
                Map.entry("{ageGroup}", context.ageGroup()),
                Map.entry("{level}", context.cefrLevel().name()),
                Map.entry("{interests}", interests),
                Map.entry("{toneInstruction}", toneInstruction(context.toneStyle()))
        );

        String template;
        try {
            template = loadPromptTemplate(LOOKUP_TEMPLATE);
        } catch (Exception e) {
            log.error("Error loading word lookup template", e);
            template = """
                    Explain the {targetLanguageName} word "{word}" for a {level} learner interested in [{interests}].
                    Return ONLY JSON with keys: target_language, native_language, selected_interest, part_of_speech,
                    base_form, gender, difficulty_level, conversation_target, explanation_native, usages_target (3 items).
                    Tone: {toneInstruction}
                    """;
        }

        String prompt = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            prompt = prompt.replace(entry.getKey(), entry.getValue());
        }
        return prompt;
    }

    static String languageName(String code) {
        if (code == null || code.isBlank()) {
            return "";
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return LANGUAGE_NAMES.getOrDefault(normalized, normalized.toUpperCase(Locale.ROOT));
    }

    static String toneInstruction(String toneStyle) {
        if (toneStyle == null || toneStyle.isBlank() || "Neutral".equalsIgnoreCase(toneStyle)) {
            return "Clear, friendly and engaging";
        }
        if ("Academic".equalsIgnoreCase(toneStyle)) {
            return "Formal, precise, academic";
        }
        return toneStyle.trim() + ", engaging";
    }

    private String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    private String loadTemplateFromResources(String templateName) {
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load prompt template: " + templateName, e);
        }
    }
}
