package uk.gegc.lingocards.features.ai.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.FileSystemResourceLoader;
import uk.gegc.lingocards.BaseUnitTest;
import uk.gegc.lingocards.features.ai.application.GenerationRequest;
import uk.gegc.lingocards.features.vocabulary.domain.model.CefrLevel;
import uk.gegc.lingocards.features.vocabulary.domain.model.PersonalizationContext;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PromptTemplateServiceImpl Tests")
class PromptTemplateServiceImplTest extends BaseUnitTest {

    private final PromptTemplateServiceImpl service = new PromptTemplateServiceImpl(new DefaultResourceLoader());

    @Test
    @DisplayName("word lookup prompt carries word, level, languages and interests")
    void buildsWordLookupPrompt() {
        GenerationRequest request = new GenerationRequest("manger", new PersonalizationContext(
                UUID.randomUUID(), "fr", "en", CefrLevel.B1, "Hockey", "Neutral", "adult",
                List.of("Hockey", "Cooking & Food")));

        String prompt = service.buildWordLookupPrompt(request);

        assertThat(prompt)
                .contains("\"manger\"", "B1", "French", "English", "[Hockey, Cooking & Food]", "adult")
                .contains("usages_target")
                .doesNotContain("{word}", "{level}", "{interests}", "{toneInstruction}");
    }

    @Test
    @DisplayName("interest context is used when there are no candidate interests")
    void usesInterestContextWithoutCandidates() {
        GenerationRequest request = new GenerationRequest("boire", new PersonalizationContext(
                null, "es", "en", CefrLevel.A1, "Travel tips", "Academic", "adult", List.of()));

        String prompt = service.buildWordLookupPrompt(request);

        assertThat(prompt).contains("[Travel tips]", "Spanish", "Formal, precise, academic");
    }

    @Test
    @DisplayName("missing templates fall back to inline prompts")
    void fallsBackWhenTemplatesMissing() {
        PromptTemplateServiceImpl withoutTemplates = new PromptTemplateServiceImpl(
                new FileSystemResourceLoader() {
                    @Override
                    public org.springframework.core.io.Resource getResource(String location) {
                        return super.getResource("/nonexistent/" + UUID.randomUUID());
                    }
                });
        GenerationRequest request = new GenerationRequest("manger", new PersonalizationContext(
                null, "fr", "en", CefrLevel.A2, "General", "Neutral", "adult", List.of("Daily Life")));

        assertThat(withoutTemplates.buildSystemPrompt()).contains("JSON");
        assertThat(withoutTemplates.buildWordLookupPrompt(request)).contains("\"manger\"", "A2", "[Daily Life]");
    }

    @Test
    @DisplayName("language names and tone instructions")
    void languageNamesAndTone() {
        assertThat(PromptTemplateServiceImpl.languageName("ZH")).isEqualTo("Chinese");
        assertThat(PromptTemplateServiceImpl.languageName("nl")).isEqualTo("NL");
        assertThat(PromptTemplateServiceImpl.toneInstruction("Neutral")).isEqualTo("Clear, friendly and engaging");
        assertThat(PromptTemplateServiceImpl.toneInstruction("Playful")).isEqualTo("Playful, engaging");
    }
}
