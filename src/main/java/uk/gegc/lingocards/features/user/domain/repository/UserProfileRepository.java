package uk.gegc.lingocards.features.user.domain.repository;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.lingocards.features.user.domain.model.UserProfile;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, UUID> {

    Optional<UserProfile> findByUser_Id(UUID userId);

    @EntityGraph(attributePaths = "selectedInterests")
    Optional<UserProfile> findWithInterestsByUser_Id(UUID userId);
}
