package uk.gegc.lingocards.features.interest.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.lingocards.features.interest.application.InterestGraphService;
import uk.gegc.lingocards.features.interest.application.InterestTaxonomyService;
import uk.gegc.lingocards.features.interest.domain.model.InterestAction;
import uk.gegc.lingocards.features.interest.domain.model.InterestTag;
import uk.gegc.lingocards.features.interest.domain.repository.InterestTagRepository;
import uk.gegc.lingocards.features.user.domain.model.UserProfile;
import uk.gegc.lingocards.features.user.domain.repository.UserProfileRepository;
import uk.gegc.lingocards.shared.config.InterestProperties;
import uk.gegc.lingocards.shared.exception.ResourceNotFoundException;

import java.util.*;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class InterestTaxonomyServiceImpl implements InterestTaxonomyService {

    private final InterestTagRepository tagRepository;
    private final UserProfileRepository profileRepository;
    private final InterestGraphService interestGraphService;
    private final TransactionTemplate transactionTemplate;
    private final InterestProperties interestProperties;

    @Override
    public List<InterestTag> selectInterests(UUID userId, Collection<String> tagSlugs) {
        Set<String> slugs = tagSlugs == null ? Set.of() : tagSlugs.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));

        List<InterestTag> tags = slugs.isEmpty() ? List.of() : tagRepository.findBySlugIn(slugs);
        if (tags.size() != slugs.size()) {
            Set<String> found = tags.stream().map(InterestTag::getSlug).collect(Collectors.toSet());
            List<String> unknown = slugs.stream().filter(s -> !found.contains(s)).toList();
            throw new IllegalArgumentException("Unknown interest tags: " + unknown);
        }

        List<InterestTag> newlySelected = replaceSelectionWithRetry(userId, tags);

        // the selection is committed before the graph is touched
        for (InterestTag tag : newlySelected) {
            interestGraphService.recordInteraction(userId, tag.getName(), InterestAction.EXPLICIT_TAG.getCode());
        }

        log.info("Interests selected: userId={}, selected={}, newlySelected={}",
                userId, tags.size(), newlySelected.size());
        return tags;
    }

    private List<InterestTag> replaceSelectionWithRetry(UUID userId, List<InterestTag> tags) {
        int maxRetries = Math.max(1, interestProperties.getMaxUpdateRetries());
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return transactionTemplate.execute(status -> replaceSelection(userId, tags));
            } catch (OptimisticLockingFailureException e) {
                log.warn("Interest selection write conflict: userId={}, attempt={}", userId, attempt + 1);
                if (attempt == maxRetries - 1) throw e;
                sleepBackoff(attempt + 1);
            }
        }
        throw new IllegalStateException("Interest selection loop exited without result");
    }

    /**
     * @return the tags that were not selected before
     */
    private List<InterestTag> replaceSelection(UUID userId, List<InterestTag> tags) {
        UserProfile profile = profileRepository.findWithInterestsByUser_Id(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Profile for user " + userId + " not found"));

        Set<UUID> previous = profile.getSelectedInterests().stream()
                .map(InterestTag::getId)
                .collect(Collectors.toSet());
        List<InterestTag> added = tags.stream()
                .filter(tag -> !previous.contains(tag.getId()))
                .toList();

        profile.getSelectedInterests().clear();
        profile.getSelectedInterests().addAll(tags);
        profileRepository.saveAndFlush(profile);
        return added;
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(50L * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
