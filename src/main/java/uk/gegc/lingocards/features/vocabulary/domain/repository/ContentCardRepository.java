package uk.gegc.lingocards.features.vocabulary.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.lingocards.features.vocabulary.domain.model.CefrLevel;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCard;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContentCardRepository extends JpaRepository<ContentCard, UUID> {

    @Query("""
            SELECT c FROM ContentCard c
            JOIN FETCH c.word w
            WHERE w.id = :wordId
              AND c.targetLanguage = :targetLanguage
              AND c.targetCefr = :targetCefr
              AND c.interestContext = :interestContext
              AND c.toneStyle = :toneStyle
            """)
    Optional<ContentCard> findByPersonalizationKey(
            @Param("wordId") UUID wordId,
            @Param("targetLanguage") String targetLanguage,
            @Param("targetCefr") CefrLevel targetCefr,
            @Param("interestContext") String interestContext,
            @Param("toneStyle") String toneStyle
    );

    boolean existsByWord_Id(UUID wordId);
}
