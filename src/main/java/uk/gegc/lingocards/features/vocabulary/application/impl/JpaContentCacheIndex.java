package uk.gegc.lingocards.features.vocabulary.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.lingocards.features.vocabulary.application.ContentCacheIndex;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCard;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCardKey;
import uk.gegc.lingocards.features.vocabulary.domain.repository.ContentCardRepository;

import java.util.Optional;

@Service
public class JpaContentCacheIndex implements ContentCacheIndex {

    private static final Logger log = LoggerFactory.getLogger(JpaContentCacheIndex.class);

    private final ContentCardRepository cardRepository;
    private final ContentCacheIndex self;

    public JpaContentCacheIndex(ContentCardRepository cardRepository, @Lazy ContentCacheIndex self) {
        this.cardRepository = cardRepository;
        this.self = self;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ContentCard> find(ContentCardKey key) {
        return cardRepository.findByPersonalizationKey(
                key.wordId(),
                key.targetLanguage(),
                key.cefrLevel(),
                key.interestContext(),
                key.toneStyle()
        );
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ContentCard insert(ContentCard card) {
        return cardRepository.saveAndFlush(card);
    }

    @Override
    public ContentCard findOrInsert(ContentCard card) {
        ContentCardKey key = ContentCardKey.of(card);
        Optional<ContentCard> existing = self.find(key);
        if (existing.isPresent()) {
            return existing.get();
        }

        try {
            ContentCard saved = self.insert(card);
            log.info("Content card stored: key={}, fallback={}", key, saved.isFallback());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("Content card insert lost a race, re-reading: key={}", key);
            return self.find(key).orElseThrow(() -> e);
        }
    }
}
