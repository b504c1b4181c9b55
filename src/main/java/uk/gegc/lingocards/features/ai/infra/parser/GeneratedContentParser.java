package uk.gegc.lingocards.features.ai.infra.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.lingocards.features.ai.application.GeneratedContent;
import uk.gegc.lingocards.features.ai.application.GenerationRequest;
import uk.gegc.lingocards.features.vocabulary.domain.model.CefrLevel;
import uk.gegc.lingocards.features.vocabulary.domain.model.ContentCard;
import uk.gegc.lingocards.shared.exception.AIResponseParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw provider text into a {@link GeneratedContent}. Accepts both the current
 * response schema and the legacy French-only one; legacy field names never leave this class.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GeneratedContentParser {

    private static final List<String> CURRENT_FIELDS =
            List.of("conversation_target", "explanation_native", "usages_target", "difficulty_level");
    private static final List<String> LEGACY_FIELDS =
            List.of("conversation_fr", "personalized_explanation", "usages_fr", "cefr_level");

    private final ObjectMapper objectMapper;

    public GeneratedContent parse(String rawResponse, GenerationRequest request) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new AIResponseParseException("Empty response from generation provider");
        }

        JsonNode root = readObject(rawResponse);

        boolean current = hasAll(root, CURRENT_FIELDS);
        boolean legacy = hasAll(root, LEGACY_FIELDS);
        if (!current && !legacy) {
            throw new AIResponseParseException("Missing required fields. Need either " + CURRENT_FIELDS
                    + " or " + LEGACY_FIELDS);
        }

        String conversation;
        String explanation;
        JsonNode usagesNode;
        String levelText;
        String language;
        if (current) {
            conversation = text(root, "conversation_target");
            explanation = text(root, "explanation_native");
            usagesNode = root.get("usages_target");
            levelText = text(root, "difficulty_level");
            language = text(root, "target_language");
        } else {
            log.debug("Normalizing legacy response schema for word '{}'", request.wordText());
            conversation = text(root, "conversation_fr");
            explanation = text(root, "personalized_explanation");
            usagesNode = root.get("usages_fr");
            levelText = text(root, "cefr_level");
            language = text(root, "language");
        }

        if (!usagesNode.isArray()) {
            throw new AIResponseParseException("Usages must be an array, got " + usagesNode.getNodeType());
        }
        if (explanation == null) {
            throw new AIResponseParseException("Explanation is empty");
        }
        CefrLevel level = CefrLevel.fromCode(levelText)
                .orElseThrow(() -> new AIResponseParseException("Invalid difficulty level: " + levelText));

        String targetLanguage = language == null
                ? request.context().targetLanguage()
                : language.toLowerCase(Locale.ROOT);

        return GeneratedContent.builder()
                .inputWord(firstNonNull(text(root, "input_word"), request.wordText()))
                .definition(explanation)
                .conversationalExample(conversation)
                .usages(normalizeUsages(usagesNode))
                .resolvedLevel(level)
                .resolvedTargetLanguage(targetLanguage)
                .nativeLanguage(firstNonNull(text(root, "native_language"), request.context().nativeLanguage()))
                .partOfSpeech(text(root, "part_of_speech"))
                .baseForm(text(root, "base_form"))
                .gender(normalizeGender(text(root, "gender")))
                .selectedInterest(text(root, "selected_interest"))
                .build();
    }

    static String cleanResponse(String response) {
        String cleaned = response.trim();

        cleaned = cleaned.replaceAll("```json\\s*", "");
        cleaned = cleaned.replaceAll("```\\s*", "");

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new AIResponseParseException("No JSON object found in response");
        }
        cleaned = cleaned.substring(start, end + 1);

        // trailing commas before a closing brace or bracket
        return cleaned.replaceAll(",\\s*([}\\]])", "$1");
    }

    static List<String> normalizeUsages(JsonNode usagesNode) {
        List<String> usages = new ArrayList<>(ContentCard.USAGE_EXAMPLE_COUNT);
        for (JsonNode usage : usagesNode) {
            if (usages.size() == ContentCard.USAGE_EXAMPLE_COUNT) {
                break;
            }
            usages.add(usage.isNull() ? "" : usage.asText().trim());
        }
        while (usages.size() < ContentCard.USAGE_EXAMPLE_COUNT) {
            usages.add("");
        }
        return usages;
    }

    static String normalizeGender(String gender) {
        if (gender == null) {
            return null;
        }
        String normalized = gender.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("m")) {
            return "m";
        }
        if (normalized.startsWith("f")) {
            return "f";
        }
        return null;
    }

    private JsonNode readObject(String rawResponse) {
        String json = cleanResponse(rawResponse);
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new AIResponseParseException("Response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new AIResponseParseException("Failed to parse generation response: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean hasAll(JsonNode root, List<String> fields) {
        return fields.stream().allMatch(root::has);
    }

    /**
     * Trimmed text of a field, or null when it is absent, JSON null or blank.
     */
    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static String firstNonNull(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
