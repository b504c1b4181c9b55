package uk.gegc.lingocards.features.interest.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.dao.OptimisticLockingFailureException;
import uk.gegc.lingocards.BaseUnitTest;
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
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("InterestGraphServiceImpl Tests")
class InterestGraphServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Mock
    private UserProfileRepository profileRepository;

    @Mock
    private InterestGraphService self;

    private InterestGraphCodec codec;
    private PersonalizationProperties personalizationProperties;
    private InterestGraphServiceImpl service;
    private UUID userId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        codec = new InterestGraphCodec(new ObjectMapper(), clock);
        InterestProperties properties = new InterestProperties();
        personalizationProperties = new PersonalizationProperties();
        service = new InterestGraphServiceImpl(profileRepository, codec, properties, personalizationProperties,
                clock, self);
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("applyInteraction decays the stored score, adds the weight and writes the whole graph")
    void applyInteractionRewritesGraph() {
        UserProfile profile = new UserProfile();
        profile.setInterestGraph(codec.write(InterestGraph.of(Map.of(
                "Hockey", new InterestScore("Hockey", 0.8, NOW.minus(Duration.ofDays(1)), 2, 0.5),
                "Cooking", new InterestScore("Cooking", 0.2, NOW, 1, 0.95)))));
        when(profileRepository.findByUser_Id(userId)).thenReturn(Optional.of(profile));

        InterestScore updated = service.applyInteraction(userId, "Hockey", InterestAction.SHARE);

        assertThat(updated.score()).isCloseTo(1.0, within(1e-9));
        assertThat(updated.interactionCount()).isEqualTo(3);
        verify(profileRepository).saveAndFlush(profile);
        InterestGraph stored = codec.read(profile.getInterestGraph());
        assertThat(stored.asMap()).containsOnlyKeys("Hockey", "Cooking");
        assertThat(stored.get("Hockey")).contains(updated);
    }

    @Test
    @DisplayName("applyInteraction on a missing profile throws ResourceNotFoundException")
    void applyInteractionWithoutProfile() {
        when(profileRepository.findByUser_Id(userId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.applyInteraction(userId, "Hockey", InterestAction.CLICK))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("unknown action is rejected before any read or write")
    void unknownActionLeavesGraphUntouched() {
        assertThatThrownBy(() -> service.recordInteraction(userId, "Hockey", "laugh"))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(self, profileRepository);
    }

    @Test
    @DisplayName("blank label is rejected before any read or write")
    void blankLabelRejected() {
        assertThatThrownBy(() -> service.recordInteraction(userId, "  ", "click"))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(self, profileRepository);
    }

    @Test
    @DisplayName("write conflict is retried with a fresh read")
    void retriesOnOptimisticLockFailure() {
        InterestScore expected = new InterestScore("Hockey", 0.1, NOW, 1, 0.95);
        when(self.applyInteraction(userId, "Hockey", InterestAction.CLICK))
                .thenThrow(new OptimisticLockingFailureException("stale"))
                .thenReturn(expected);

        InterestScore result = service.recordInteraction(userId, " Hockey ", "click");

        assertThat(result).isEqualTo(expected);
        verify(self, times(2)).applyInteraction(userId, "Hockey", InterestAction.CLICK);
    }

    @Test
    @DisplayName("persistent write conflicts surface after the configured attempts")
    void givesUpAfterMaxRetries() {
        when(self.applyInteraction(eq(userId), anyString(), any(InterestAction.class)))
                .thenThrow(new OptimisticLockingFailureException("stale"));

        assertThatThrownBy(() -> service.recordInteraction(userId, "Hockey", "click"))
                .isInstanceOf(OptimisticLockingFailureException.class);
        verify(self, times(3)).applyInteraction(userId, "Hockey", InterestAction.CLICK);
    }

    @Test
    @DisplayName("topInterest is General for anonymous users, missing profiles and empty graphs")
    void topInterestDefaults() {
        UUID withoutProfile = UUID.randomUUID();
        when(profileRepository.findByUser_Id(withoutProfile)).thenReturn(Optional.empty());
        when(profileRepository.findByUser_Id(userId)).thenReturn(Optional.of(new UserProfile()));

        assertThat(service.topInterest(null)).isEqualTo("General");
        assertThat(service.topInterest(withoutProfile)).isEqualTo("General");
        assertThat(service.topInterest(userId)).isEqualTo("General");
        verify(profileRepository, never()).findByUser_Id(null);
    }

    @Test
    @DisplayName("topInterest falls back to the configured default interest")
    void topInterestUsesConfiguredDefault() {
        personalizationProperties.setDefaultInterest("Daily Life");
        when(profileRepository.findByUser_Id(userId)).thenReturn(Optional.of(new UserProfile()));

        assertThat(service.topInterest(null)).isEqualTo("Daily Life");
        assertThat(service.topInterest(userId)).isEqualTo("Daily Life");
    }

    @Test
    @DisplayName("topInterest returns the label with the highest stored score")
    void topInterestFromStoredGraph() {
        UserProfile profile = new UserProfile();
        profile.setInterestGraph(codec.write(InterestGraph.of(Map.of(
                "Hockey", new InterestScore("Hockey", 0.7, NOW, 3, 0.95),
                "Cooking", new InterestScore("Cooking", 0.4, NOW, 1, 0.95)))));
        when(profileRepository.findByUser_Id(userId)).thenReturn(Optional.of(profile));

        assertThat(service.topInterest(userId)).isEqualTo("Hockey");
    }
}
