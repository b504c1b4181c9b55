package uk.gegc.lingocards.features.vocabulary.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.lingocards.features.interest.application.InterestGraphService;
import uk.gegc.lingocards.features.interest.domain.model.InterestTag;
import uk.gegc.lingocards.features.user.domain.model.UserProfile;
import uk.gegc.lingocards.features.user.domain.repository.UserProfileRepository;
import uk.gegc.lingocards.features.user.domain.repository.UserRepository;
import uk.gegc.lingocards.features.vocabulary.domain.model.CefrLevel;
import uk.gegc.lingocards.features.vocabulary.domain.model.PersonalizationContext;
import uk.gegc.lingocards.shared.config.PersonalizationProperties;
import uk.gegc.lingocards.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the learner's {@link PersonalizationContext} once per lookup, applying the
 * configured defaults to anything the profile leaves unset.
 */
@Component
@RequiredArgsConstructor
public class PersonalizationContextResolver {

    private final UserRepository userRepository;
    private final UserProfileRepository profileRepository;
    private final InterestGraphService interestGraphService;
    private final PersonalizationProperties properties;

    @Transactional(readOnly = true)
    public PersonalizationContext resolve(UUID userId) {
        if (userId == null) {
            return defaults(null, properties.getDefaultInterest());
        }
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User " + userId + " not found");
        }

        String interest = interestGraphService.topInterest(userId);
        Optional<UserProfile> maybeProfile = profileRepository.findWithInterestsByUser_Id(userId);
        if (maybeProfile.isEmpty()) {
            return defaults(userId, interest);
        }
        UserProfile profile = maybeProfile.get();

        List<String> selected = profile.getSelectedInterests().stream()
                .map(InterestTag::getName)
                .limit(properties.getMaxCandidateInterests())
                .toList();

        return new PersonalizationContext(
                userId,
                languageOrDefault(profile.getTargetLanguage(), properties.getDefaultTargetLanguage()),
                languageOrDefault(profile.getNativeLanguage(), properties.getDefaultNativeLanguage()),
                profile.getCefrLevel() != null ? profile.getCefrLevel() : defaultLevel(),
                interest,
                properties.getDefaultTone(),
                profile.getAgeGroup() != null ? profile.getAgeGroup().getCode() : properties.getDefaultAgeGroup(),
                selected.isEmpty() ? properties.getDefaultCandidateInterests() : selected
        );
    }

    private PersonalizationContext defaults(UUID userId, String interest) {
        return new PersonalizationContext(
                userId,
                properties.getDefaultTargetLanguage(),
                properties.getDefaultNativeLanguage(),
                defaultLevel(),
                interest,
                properties.getDefaultTone(),
                properties.getDefaultAgeGroup(),
                properties.getDefaultCandidateInterests()
        );
    }

    private CefrLevel defaultLevel() {
        return CefrLevel.fromCode(properties.getDefaultCefrLevel()).orElse(CefrLevel.A1);
    }

    private static String languageOrDefault(String language, String fallback) {
        return language == null || language.isBlank() ? fallback : language.trim().toLowerCase(Locale.ROOT);
    }
}
