package uk.gegc.lingocards.features.interest.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.lingocards.features.interest.domain.model.InterestCategory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InterestCategoryRepository extends JpaRepository<InterestCategory, UUID> {

    Optional<InterestCategory> findByName(String name);

    List<InterestCategory> findAllByOrderByDisplayOrderAscNameAsc();
}
