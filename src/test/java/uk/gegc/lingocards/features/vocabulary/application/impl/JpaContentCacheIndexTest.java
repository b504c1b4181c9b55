package uk.gegc.lingocards.features.vocabulary.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.lingocards.BaseUnitTest;
import uk.gegc.lingocards.features.vocabulary.application.ContentCacheIndex;
import uk.gegc.lingocards.features.vocabulary.domain.model.CefrLevel;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCard;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCardKey;
import uk.gegc.lingocards.features.vocabulary.domain.model.Word;
import uk.gegc.lingocards.features.vocabulary.domain.repository.ContentCardRepository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("JpaContentCacheIndex Tests")
class JpaContentCacheIndexTest extends BaseUnitTest {

    private static final Instant CLAIMED_AT = Instant.parse("2024-01-01T12:00:00Z");

    @Mock
    private ContentCardRepository cardRepository;

    @Mock
    private ContentCacheIndex self;

    private JpaContentCacheIndex index;
    private ContentCard candidate;
    private ContentCardKey key;

    @BeforeEach
    void setUp() {
        index = new JpaContentCacheIndex(cardRepository, self);

        Word word = new Word("manger", "fr", CLAIMED_AT);
        word.setId(UUID.randomUUID());
        candidate = new ContentCard();
        candidate.setWord(word);
        candidate.setTargetLanguage("fr");
        candidate.setTargetCefr(CefrLevel.B1);
        candidate.setInterestContext("Hockey");
        candidate.setToneStyle("Neutral");
        candidate.setDefinition("To eat.");
        key = ContentCardKey.of(candidate);
    }

    @Test
    @DisplayName("find queries by every key part")
    void findUsesFullKey() {
        when(cardRepository.findByPersonalizationKey(key.wordId(), "fr", CefrLevel.B1, "Hockey", "Neutral"))
                .thenReturn(Optional.of(candidate));

        assertThat(index.find(key)).contains(candidate);
    }

    @Test
    @DisplayName("findOrInsert returns the existing card without inserting")
    void findOrInsertReturnsExisting() {
        ContentCard existing = new ContentCard();
        when(self.find(key)).thenReturn(Optional.of(existing));

        assertThat(index.findOrInsert(candidate)).isSameAs(existing);
        verify(self, never()).insert(any());
    }

    @Test
    @DisplayName("findOrInsert inserts on a miss")
    void findOrInsertInsertsOnMiss() {
        when(self.find(key)).thenReturn(Optional.empty());
        when(self.insert(candidate)).thenReturn(candidate);

        assertThat(index.findOrInsert(candidate)).isSameAs(candidate);
    }

    @Test
    @DisplayName("a lost insert race returns the winner's card")
    void lostRaceReturnsWinner() {
        ContentCard winner = new ContentCard();
        when(self.find(key)).thenReturn(Optional.empty()).thenReturn(Optional.of(winner));
        when(self.insert(candidate)).thenThrow(new DataIntegrityViolationException("uq_content_cards_personalization_key"));

        assertThat(index.findOrInsert(candidate)).isSameAs(winner);
    }

    @Test
    @DisplayName("a constraint violation without a winner is rethrown")
    void violationWithoutWinnerIsRethrown() {
        when(self.find(key)).thenReturn(Optional.empty());
        when(self.insert(candidate)).thenThrow(new DataIntegrityViolationException("fk_content_cards_word"));

        assertThatThrownBy(() -> index.findOrInsert(candidate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("insert saves and flushes")
    void insertSavesAndFlushes() {
        when(cardRepository.saveAndFlush(candidate)).thenReturn(candidate);

        assertThat(index.insert(candidate)).isSameAs(candidate);
        verify(cardRepository).saveAndFlush(candidate);
    }
}
