package uk.gegc.lingocards.features.vocabulary.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.lingocards.features.ai.application.GeneratedContent;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCard;
import uk.gegc.lingocards.features.vocabulary.domain.model.PersonalizationContext;
import uk.gegc.lingocards.features.vocabulary.domain.model.Word;
import uk.gegc.lingocards.shared.config.PersonalizationProperties;

import java.util.List;

/**
 * Builds unsaved content cards. Both kinds are keyed by the requested personalization
 * key, never by what the generator reports back.
 */
@Component
@RequiredArgsConstructor
public class ContentCardFactory {

    private final PersonalizationProperties properties;

    public ContentCard fromGenerated(Word word, PersonalizationContext context, GeneratedContent content) {
        ContentCard card = keyedCard(word, context);
        card.setDefinition(content.definition());
        card.setConversation(content.conversationalExample());
        card.setExamples(content.usages());
        card.setPartOfSpeech(content.partOfSpeech());
        card.setBaseForm(content.baseForm());
        card.setGender(content.gender());
        card.setResolvedCefr(content.resolvedLevel());
        card.setResolvedLanguage(content.resolvedTargetLanguage());
        card.setFallback(false);
        return card;
    }

    public ContentCard fallback(Word word, PersonalizationContext context) {
        ContentCard card = keyedCard(word, context);
        card.setDefinition(properties.getFallbackDefinition().replace("{word}", word.getText()));
        card.setConversation("");
        card.setExamples(List.of());
        card.setFallback(true);
        return card;
    }

    private static ContentCard keyedCard(Word word, PersonalizationContext context) {
        ContentCard card = new ContentCard();
        card.setWord(word);
        card.setTargetLanguage(context.targetLanguage());
        card.setTargetCefr(context.cefrLevel());
        card.setInterestContext(context.interestContext());
        card.setToneStyle(context.toneStyle());
        return card;
    }
}
