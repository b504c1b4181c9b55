package uk.gegc.lingocards.features.vocabulary.application;

import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCard;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCardKey;

import java.util.Optional;

/**
 * Append-only index of generated content cards, keyed by {@link ContentCardKey}.
 */
public interface ContentCacheIndex {

    Optional<ContentCard> find(ContentCardKey key);

    /**
     * Inserts a new card in its own transaction.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if a card with the same key exists
     */
    ContentCard insert(ContentCard card);

    /**
     * Returns the stored card for the key of {@code card}, inserting {@code card} when there is none.
     * A concurrent insert of the same key resolves to the row that won.
     */
    ContentCard findOrInsert(ContentCard card);
}
