package uk.gegc.lingocards.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Defaults applied when a learner profile leaves a personalization field empty,
 * or when the lookup is anonymous.
 */
@Component
@ConfigurationProperties(prefix = "lingocards.personalization")
@Data
public class PersonalizationProperties {

    private String defaultTargetLanguage = "fr";

    private String defaultNativeLanguage = "en";

    private String defaultCefrLevel = "A1";

    private String defaultInterest = "General";

    private String defaultTone = "Neutral";

    private String defaultAgeGroup = "adult";

    /**
     * Interests offered to the generator when the learner has not picked any tags
     */
    private List<String> defaultCandidateInterests = new ArrayList<>(List.of("General Knowledge", "Daily Life"));

    /**
     * How many selected interest tags are offered to the generator
     */
    private int maxCandidateInterests = 3;

    /**
     * Definition stored on the placeholder card written when generation fails.
     * {word} is replaced with the looked up text.
     */
    private String fallbackDefinition = "Definition for {word}";

    /**
     * A word without content cards may be moved to another language only once its last
     * claim is older than this. Must exceed the longest generation run, retries included.
     */
    private Duration wordClaimWindow = Duration.ofMinutes(10);
}
