package uk.gegc.lingocards.features.interest.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.lingocards.features.interest.domain.model.InterestTag;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InterestTagRepository extends JpaRepository<InterestTag, UUID> {

    Optional<InterestTag> findByCategory_IdAndName(UUID categoryId, String name);

    List<InterestTag> findBySlugIn(Collection<String> slugs);
}
