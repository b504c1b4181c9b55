package uk.gegc.lingocards.features.vocabulary.domain.repository;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.lingocards.features.vocabulary.domain.model.VocabularyMembership;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VocabularyMembershipRepository extends JpaRepository<VocabularyMembership, UUID> {

    @EntityGraph(attributePaths = {"card", "card.word"})
    Optional<VocabularyMembership> findByUser_IdAndCard_Id(UUID userId, UUID cardId);

    @EntityGraph(attributePaths = {"card", "card.word"})
    Optional<VocabularyMembership> findByIdAndUser_Id(UUID id, UUID userId);

    @EntityGraph(attributePaths = {"card", "card.word"})
    List<VocabularyMembership> findByUser_IdOrderByAddedAtDesc(UUID userId);

    @EntityGraph(attributePaths = {"card", "card.word"})
    List<VocabularyMembership> findByUser_IdAndFamiliarityOrderByAddedAtDesc(UUID userId, Integer familiarity);
}
