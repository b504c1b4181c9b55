package uk.gegc.lingocards.features.interest.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.lingocards.features.interest.application.InterestGraphService;
import uk.gegc.lingocards.features.interest.domain.model.InterestAction;
import uk.gegc.lingocards.features.interest.domain.model.InterestGraph;
import uk.gegc.lingocards.features.interest.domain.model.InterestScore;
import uk.gegc.lingocards.features.interest.infra.serialization.InterestGraphCodec;
import uk.gegc.lingocards.features.user.domain.model.UserProfile;
import uk.gegc.lingocards.features.user.domain.repository.UserProfileRepository;
import uk.gegc.lingocards.shared.config.InterestProperties;
import uk.gegc.lingocards.shared.config.PersonalizationProperties;
import uk.gegc.lingocards.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Service
public class InterestGraphServiceImpl implements InterestGraphService {

    private static final Logger log = LoggerFactory.getLogger(InterestGraphServiceImpl.class);

    private final UserProfileRepository profileRepository;
    private final InterestGraphCodec graphCodec;
    private final InterestProperties interestProperties;
    private final PersonalizationProperties personalizationProperties;
    private final Clock clock;

    private final InterestGraphService self;

    public InterestGraphServiceImpl(
            UserProfileRepository profileRepository,
            InterestGraphCodec graphCodec,
            InterestProperties interestProperties,
            PersonalizationProperties personalizationProperties,
            Clock clock,
            @Lazy InterestGraphService self
    ) {
        this.profileRepository = profileRepository;
        this.graphCodec = graphCodec;
        this.interestProperties = interestProperties;
        this.personalizationProperties = personalizationProperties;
        this.clock = clock;
        this.self = self;
    }

    @Override
    public InterestScore recordInteraction(UUID userId, String label, String actionType) {
        InterestAction action = InterestAction.fromCode(actionType);
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Interest label must not be blank");
        }
        String trimmedLabel = label.trim();

        int maxRetries = Math.max(1, interestProperties.getMaxUpdateRetries());
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                InterestScore score = self.applyInteraction(userId, trimmedLabel, action);
                log.info("Interest recorded: userId={}, label={}, action={}, score={}, interactions={}",
                        userId, trimmedLabel, action.getCode(), score.score(), score.interactionCount());
                return score;
            } catch (OptimisticLockingFailureException e) {
                log.warn("Interest graph write conflict: userId={}, label={}, attempt={}",
                        userId, trimmedLabel, attempt + 1);
                if (attempt == maxRetries - 1) throw e;
                sleepBackoff(attempt + 1);
            }
        }
        throw new IllegalStateException("Interest graph update loop exited without result");
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public InterestScore applyInteraction(UUID userId, String label, InterestAction action) {
        UserProfile profile = profileRepository.findByUser_Id(userId)
                .orElseThrow(() -> new ResourceNotFoundException("Profile for user " + userId + " not found"));

        InterestGraph graph = graphCodec.read(profile.getInterestGraph());
        InterestScore updated = graph.recordInteraction(
                label, action, Instant.now(clock), interestProperties.getDefaultDecayRate());

        profile.setInterestGraph(graphCodec.write(graph));
        profileRepository.saveAndFlush(profile);
        return updated;
    }

    @Override
    @Transactional(readOnly = true)
    public InterestGraph getGraph(UUID userId) {
        if (userId == null) {
            return InterestGraph.empty();
        }
        return profileRepository.findByUser_Id(userId)
                .map(profile -> graphCodec.read(profile.getInterestGraph()))
                .orElseGet(InterestGraph::empty);
    }

    @Override
    @Transactional(readOnly = true)
    public String topInterest(UUID userId) {
        return getGraph(userId).topInterest().orElse(personalizationProperties.getDefaultInterest());
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(50L * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
