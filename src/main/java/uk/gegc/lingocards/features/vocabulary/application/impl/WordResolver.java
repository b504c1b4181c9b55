package uk.gegc.lingocards.features.vocabulary.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.lingocards.features.vocabulary.domain.model.Word;
import uk.gegc.lingocards.features.vocabulary.domain.repository.ContentCardRepository;
import uk.gegc.lingocards.features.vocabulary.domain.repository.WordRepository;
import uk.gegc.lingocards.shared.config.PersonalizationProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Finds or creates the {@link Word} for a normalized text in a target language.
 * <p>
 * A same-text word stored under another language is moved to the requested language
 * only when it has no content and its claim has expired. A word whose lookup may still
 * be generating content keeps its language; the new language gets its own row.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WordResolver {

    private final WordRepository wordRepository;
    private final ContentCardRepository cardRepository;
    private final TransactionTemplate transactionTemplate;
    private final PersonalizationProperties properties;
    private final Clock clock;

    public Word resolve(String normalizedText, String language) {
        try {
            return transactionTemplate.execute(status -> findOrCreate(normalizedText, language));
        } catch (DataIntegrityViolationException e) {
            log.warn("Word insert lost a race, re-reading: text='{}', language={}", normalizedText, language);
            return transactionTemplate.execute(status -> wordRepository.findByTextAndLanguage(normalizedText, language))
                    .orElseThrow(() -> e);
        }
    }

    private Word findOrCreate(String text, String language) {
        Optional<Word> existing = wordRepository.findByTextAndLanguage(text, language);
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = Instant.now(clock);
        Optional<Word> moved = takeOverAbandonedGuess(text, language, now);
        if (moved.isPresent()) {
            return moved.get();
        }

        Word created = wordRepository.saveAndFlush(new Word(text, language, now));
        log.info("Word created: text='{}', language={}", text, language);
        return created;
    }

    private Optional<Word> takeOverAbandonedGuess(String text, String language, Instant now) {
        Instant cutoff = now.minus(properties.getWordClaimWindow());
        for (Word candidate : wordRepository.findByTextAndClaimedAtBeforeOrderByClaimedAtAsc(text, cutoff)) {
            if (cardRepository.existsByWord_Id(candidate.getId())) {
                continue;
            }
            int updated = wordRepository.reassignLanguage(
                    candidate.getId(), candidate.getLanguage(), candidate.getClaimedAt(), language, now);
            if (updated == 1) {
                log.info("Correcting word language: text='{}', {} -> {}", text, candidate.getLanguage(), language);
                return wordRepository.findById(candidate.getId());
            }
        }
        return Optional.empty();
    }
}
