package uk.gegc.lingocards.features.interest.application;

import uk.gegc.lingocards.features.interest.domain.model.InterestTag;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface InterestTaxonomyService {

    /**
     * Replaces the learner's selected interest tags. Every tag that was not selected
     * before is also recorded as an {@code explicit_tag} interaction in the weighted graph.
     *
     * @throws IllegalArgumentException if a slug does not match a known tag
     */
    List<InterestTag> selectInterests(UUID userId, Collection<String> tagSlugs);
}
