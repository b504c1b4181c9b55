package uk.gegc.lingocards.features.interest.infra.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.lingocards.features.interest.domain.model.InterestGraph;
import uk.gegc.lingocards.features.interest.domain.model.InterestScore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the JSON document stored in {@code user_profiles.interest_graph}.
 * <pre>
 * {"Hockey": {"label": "Hockey", "score": 0.4, "last_updated": "2024-01-01T12:00:00Z",
 *             "interaction_count": 3, "decay_rate": 0.95}}
 * </pre>
 * Reading never fails: an unreadable document yields an empty graph and an unreadable
 * entry is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InterestGraphCodec {

    static final String LABEL = "label";
    static final String SCORE = "score";
    static final String LAST_UPDATED = "last_updated";
    static final String INTERACTION_COUNT = "interaction_count";
    static final String DECAY_RATE = "decay_rate";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InterestGraph read(String json) {
        if (!StringUtils.hasText(json)) {
            return InterestGraph.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable interest graph document, using empty graph: {}", e.getOriginalMessage());
            return InterestGraph.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("Interest graph document is not a JSON object, using empty graph");
            return InterestGraph.empty();
        }

        Map<String, InterestScore> scores = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                InterestScore score = readScore(field.getKey(), field.getValue());
                scores.put(field.getKey(), score);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unreadable interest '{}': {}", field.getKey(), e.getMessage());
            }
        }
        return InterestGraph.of(scores);
    }

    public String write(InterestGraph graph) {
        ObjectNode root = objectMapper.createObjectNode();
        graph.asMap().forEach((label, score) -> {
            ObjectNode node = root.putObject(label);
            node.put(LABEL, score.label());
            node.put(SCORE, score.score());
            node.put(LAST_UPDATED, score.lastUpdated().toString());
            node.put(INTERACTION_COUNT, score.interactionCount());
            node.put(DECAY_RATE, score.decayRate());
        });
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize interest graph", e);
        }
    }

    private InterestScore readScore(String key, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("entry is not an object");
        }
        String label = node.hasNonNull(LABEL) ? node.get(LABEL).asText() : key;
        double score = node.hasNonNull(SCORE) ? node.get(SCORE).asDouble() : 0.0;
        int interactionCount = node.hasNonNull(INTERACTION_COUNT) ? node.get(INTERACTION_COUNT).asInt() : 0;
        double decayRate = node.hasNonNull(DECAY_RATE)
                ? node.get(DECAY_RATE).asDouble()
                : InterestScore.DEFAULT_DECAY_RATE;
        Instant lastUpdated = parseInstant(node.get(LAST_UPDATED));
        return new InterestScore(label, score, lastUpdated, interactionCount, decayRate);
    }

    private Instant parseInstant(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return Instant.now(clock);
        }
        String text = node.asText().trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            // timestamps written without an offset are read in the application zone
            try {
                return LocalDateTime.parse(text).atZone(clock.getZone()).toInstant();
            } catch (DateTimeParseException unparseable) {
                log.debug("Unparseable last_updated '{}', using current time", text);
                return Instant.now(clock);
            }
        }
    }
}
