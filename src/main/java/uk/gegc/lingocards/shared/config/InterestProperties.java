package uk.gegc.lingocards.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the weighted interest graph
 */
@Component
@ConfigurationProperties(prefix = "lingocards.interests")
@Data
public class InterestProperties {

    /**
     * Per-day decay factor given to labels the first time they are recorded
     */
    private double defaultDecayRate = 0.95;

    /**
     * Attempts to rewrite a graph when another request updated the profile first
     */
    private int maxUpdateRetries = 3;

    /**
     * Create the built-in interest categories and tags on start-up
     */
    private boolean seedOnStartup = true;
}
