package uk.gegc.lingocards.features.vocabulary.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.lingocards.features.ai.application.ContentGenerationGateway;
import uk.gegc.lingocards.features.ai.application.GeneratedContent;
import uk.gegc.lingocards.features.ai.application.GenerationRequest;
import uk.gegc.lingocards.features.user.domain.repository.UserRepository;
import uk.gegc.lingocards.features.vocabulary.application.ContentCacheIndex;
import uk.gegc.lingocards.features.vocabulary.application.ContentCacheMetricsService;
import uk.gegc.lingocards.features.vocabulary.application.PersonalizationContextResolver;
import uk.gegc.lingocards.features.vocabulary.application.PersonalizationResolver;
import uk.gegc.lingocards.features.vocabulary.application.WordLookupResult;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCard;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCardKey;
import uk.gegc.lingocards.features.vocabulary.domain.model.PersonalizationContext;
import uk.gegc.lingocards.features.vocabulary.domain.model.VocabularyMembership;
import uk.gegc.lingocards.features.vocabulary.domain.model.Word;
import uk.gegc.lingocards.features.vocabulary.domain.repository.VocabularyMembershipRepository;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Lookup flow: context, word, cache, generation on miss, membership.
 * Each write runs in its own short transaction; the generator is called outside any.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PersonalizationResolverImpl implements PersonalizationResolver {

    private final PersonalizationContextResolver contextResolver;
    private final WordResolver wordResolver;
    private final ContentCacheIndex cacheIndex;
    private final ContentGenerationGateway generationGateway;
    private final ContentCardFactory cardFactory;
    private final VocabularyMembershipRepository membershipRepository;
    private final UserRepository userRepository;
    private final TransactionTemplate transactionTemplate;
    private final ContentCacheMetricsService metricsService;

    @Override
    public WordLookupResult fetchWordContent(UUID userId, String wordText) {
        if (wordText == null || wordText.isBlank()) {
            throw new IllegalArgumentException("Word text cannot be empty");
        }
        String normalized = wordText.trim().toLowerCase(Locale.ROOT);

        PersonalizationContext context = contextResolver.resolve(userId);
        Word word = wordResolver.resolve(normalized, context.targetLanguage());
        ContentCardKey key = context.cacheKeyFor(word);

        Optional<ContentCard> cached = cacheIndex.find(key);
        ContentCard card;
        if (cached.isPresent()) {
            card = cached.get();
            metricsService.incrementCacheHit();
            log.info("Content cache hit: word='{}', key={}", normalized, key);
        } else {
            metricsService.incrementCacheMiss();
            log.info("Content cache miss: word='{}', key={}", normalized, key);
            card = cacheIndex.findOrInsert(buildCard(word, context));
        }

        VocabularyMembership membership = context.isAnonymous() ? null : findOrCreateMembership(userId, card);
        return new WordLookupResult(card, membership, cached.isPresent(), !card.isFallback());
    }

    private ContentCard buildCard(Word word, PersonalizationContext context) {
        try {
            GeneratedContent content = generationGateway.generate(new GenerationRequest(word.getText(), context));
            return cardFactory.fromGenerated(word, context, content);
        } catch (RuntimeException e) {
            log.warn("Content generation failed, using fallback card: word='{}', key={}, reason={}",
                    word.getText(), context.cacheKeyFor(word), e.getMessage());
            metricsService.incrementFallback();
            return cardFactory.fallback(word, context);
        }
    }

    private VocabularyMembership findOrCreateMembership(UUID userId, ContentCard card) {
        try {
            return transactionTemplate.execute(status -> membershipRepository
                    .findByUser_IdAndCard_Id(userId, card.getId())
                    .orElseGet(() -> createMembership(userId, card)));
        } catch (DataIntegrityViolationException e) {
            log.warn("Vocabulary membership insert lost a race, re-reading: userId={}, cardId={}",
                    userId, card.getId());
            return transactionTemplate.execute(status -> membershipRepository.findByUser_IdAndCard_Id(userId, card.getId()))
                    .orElseThrow(() -> e);
        }
    }

    private VocabularyMembership createMembership(UUID userId, ContentCard card) {
        VocabularyMembership membership = new VocabularyMembership();
        membership.setUser(userRepository.getReferenceById(userId));
        membership.setCard(card);
        membership.setFamiliarity(VocabularyMembership.MIN_FAMILIARITY);
        VocabularyMembership saved = membershipRepository.saveAndFlush(membership);
        log.info("Vocabulary membership created: userId={}, cardId={}", userId, card.getId());
        return saved;
    }
}
