package uk.gegc.lingocards.features.vocabulary.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.lingocards.features.vocabulary.application.VocabularyService;
import uk.gegc.lingocards.features.vocabulary.domain.model.VocabularyMembership;
import uk.gegc.lingocards.features.vocabulary.domain.repository.VocabularyMembershipRepository;
import uk.gegc.lingocards.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class VocabularyServiceImpl implements VocabularyService {

    private final VocabularyMembershipRepository membershipRepository;

    @Override
    @Transactional(readOnly = true)
    public List<VocabularyMembership> listForUser(UUID userId, Integer familiarity) {
        if (familiarity == null) {
            return membershipRepository.findByUser_IdOrderByAddedAtDesc(userId);
        }
        validateFamiliarity(familiarity);
        return membershipRepository.findByUser_IdAndFamiliarityOrderByAddedAtDesc(userId, familiarity);
    }

    @Override
    @Transactional
    public VocabularyMembership updateFamiliarity(UUID userId, UUID membershipId, int familiarity) {
        validateFamiliarity(familiarity);
        VocabularyMembership membership = findOwned(userId, membershipId);
        membership.setFamiliarity(familiarity);
        VocabularyMembership saved = membershipRepository.saveAndFlush(membership);
        log.info("Familiarity updated: userId={}, membershipId={}, familiarity={}", userId, membershipId, familiarity);
        return saved;
    }

    @Override
    @Transactional
    public void remove(UUID userId, UUID membershipId) {
        VocabularyMembership membership = findOwned(userId, membershipId);
        membershipRepository.delete(membership);
        log.info("Vocabulary membership removed: userId={}, membershipId={}", userId, membershipId);
    }

    private VocabularyMembership findOwned(UUID userId, UUID membershipId) {
        return membershipRepository.findByIdAndUser_Id(membershipId, userId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Vocabulary entry " + membershipId + " not found for user " + userId));
    }

    private static void validateFamiliarity(int familiarity) {
        if (familiarity < VocabularyMembership.MIN_FAMILIARITY || familiarity > VocabularyMembership.MAX_FAMILIARITY) {
            throw new IllegalArgumentException("Familiarity must be between "
                    + VocabularyMembership.MIN_FAMILIARITY + " and " + VocabularyMembership.MAX_FAMILIARITY
                    + ", got " + familiarity);
        }
    }
}
