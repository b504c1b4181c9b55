package uk.gegc.lingocards;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.lingocards.config.TestAiConfig;
import uk.gegc.lingocards.config.TestClockConfig;
import uk.gegc.lingocards.features.vocabulary.application.PersonalizationResolver;
import uk.gegc.lingocards.features.vocabulary.application.WordLookupResult;
import uk.gegc.lingocards.features.vocabulary.domain.model.CefrLevel;
import uk.gegc.lingocards.features.vocabulary.domain.repository.ContentCardRepository;
import uk.gegc.lingocards.features.vocabulary.domain.repository.WordRepository;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import({TestClockConfig.class, TestAiConfig.class})
class LingoCardsApplicationTest {

    @Autowired
    private PersonalizationResolver resolver;

    @Autowired
    private ContentCardRepository cardRepository;

    @Autowired
    private WordRepository wordRepository;

    @Autowired
    private Clock clock;

    @AfterEach
    void cleanUp() {
        cardRepository.deleteAll();
        wordRepository.deleteAll();
    }

    @Test
    void contextUsesTheFixedTestClock() {
        assertThat(clock.instant()).isEqualTo(TestClockConfig.getFixedInstant());
    }

    @Test
    void anonymousLookupRunsThroughGenerator() {
        WordLookupResult result = resolver.fetchWordContent(null, "mot");

        assertThat(result.generated()).isTrue();
        assertThat(result.card().isFallback()).isFalse();
        assertThat(result.card().getDefinition()).isEqualTo("A word.");
        assertThat(result.card().getExamples()).containsExactly("Un mot.", "Deux mots.", "Trois mots.");
        assertThat(result.card().getGender()).isEqualTo("m");
        assertThat(result.card().getResolvedCefr()).isEqualTo(CefrLevel.A1);

        WordLookupResult again = resolver.fetchWordContent(null, "mot");
        assertThat(again.cacheHit()).isTrue();
        assertThat(again.card().getId()).isEqualTo(result.card().getId());
    }
}
