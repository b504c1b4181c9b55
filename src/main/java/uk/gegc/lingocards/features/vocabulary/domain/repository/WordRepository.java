package uk.gegc.lingocards.features.vocabulary.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.lingocards.features.vocabulary.domain.model.Word;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WordRepository extends JpaRepository<Word, UUID> {

    Optional<Word> findByTextAndLanguage(String text, String language);

    List<Word> findByTextAndClaimedAtBeforeOrderByClaimedAtAsc(String text, Instant cutoff);

    /**
     * Moves a word to {@code language} and renews its claim, provided nobody changed
     * its language or claim since it was read.
     *
     * @return 1 when the row was moved, 0 when another lookup got there first
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Word w
            SET w.language = :language, w.claimedAt = :claimedAt, w.updatedAt = :claimedAt
            WHERE w.id = :id
              AND w.language = :expectedLanguage
              AND w.claimedAt = :expectedClaimedAt
            """)
    int reassignLanguage(
            @Param("id") UUID id,
            @Param("expectedLanguage") String expectedLanguage,
            @Param("expectedClaimedAt") Instant expectedClaimedAt,
            @Param("language") String language,
            @Param("claimedAt") Instant claimedAt
    );
}
