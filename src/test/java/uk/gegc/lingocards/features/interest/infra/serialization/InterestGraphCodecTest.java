package uk.gegc.lingocards.features.interest.infra.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.lingocards.BaseUnitTest;
import uk.gegc.lingocards.features.interest.domain.model.InterestGraph;
import uk.gegc.lingocards.features.interest.domain.model.InterestScore;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InterestGraphCodec Tests")
class InterestGraphCodecTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private InterestGraphCodec codec;

    @BeforeEach
    void setUp() {
        codec = new InterestGraphCodec(new ObjectMapper(), Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    @Test
    @DisplayName("write then read keeps every field")
    void writeThenReadKeepsFields() {
        Instant lastUpdated = Instant.parse("2023-12-25T08:30:00Z");
        InterestGraph graph = InterestGraph.of(Map.of(
                "Hockey", new InterestScore("Hockey", 0.42, lastUpdated, 7, 0.9)));

        String json = codec.write(graph);
        InterestGraph read = codec.read(json);

        assertThat(json).contains("\"last_updated\"", "\"interaction_count\"", "\"decay_rate\"");
        assertThat(read.get("Hockey")).contains(new InterestScore("Hockey", 0.42, lastUpdated, 7, 0.9));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "not json", "[1, 2, 3]", "{\"Hockey\": "})
    @DisplayName("unreadable documents read as an empty graph")
    void unreadableDocumentIsEmpty(String json) {
        assertThat(codec.read(json).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("missing fields fall back to defaults and current time")
    void missingFieldsUseDefaults() {
        InterestGraph graph = codec.read("{\"Cooking\": {}}");

        assertThat(graph.get("Cooking")).contains(
                new InterestScore("Cooking", 0.0, NOW, 0, InterestScore.DEFAULT_DECAY_RATE));
    }

    @Test
    @DisplayName("timestamps without offset are read in the clock zone")
    void localTimestampUsesClockZone() {
        InterestGraph graph = codec.read(
                "{\"Chess\": {\"score\": 0.5, \"last_updated\": \"2023-12-31T10:00:00\"}}");

        assertThat(graph.get("Chess")).get()
                .extracting(InterestScore::lastUpdated)
                .isEqualTo(Instant.parse("2023-12-31T10:00:00Z"));
    }

    @Test
    @DisplayName("an invalid entry is skipped, the rest survive")
    void invalidEntryIsSkipped() {
        InterestGraph graph = codec.read("""
                {
                  "Broken": {"score": 7.5},
                  "Scalar": 3,
                  "Travel": {"score": 0.3, "last_updated": "2023-12-31T12:00:00Z", "interaction_count": 1}
                }
                """);

        assertThat(graph.asMap()).containsOnlyKeys("Travel");
    }
}
