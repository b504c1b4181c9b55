package uk.gegc.lingocards.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for calls to the text generation provider
 */
@Component
@ConfigurationProperties(prefix = "lingocards.generation")
@Data
public class GenerationProperties {

    /**
     * Upper bound for a single provider round trip
     */
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Maximum number of attempts for provider errors (parse failures are never retried)
     */
    private int maxRetries = 2;

    /**
     * Base delay in milliseconds for exponential backoff
     */
    private long baseDelayMs = 500;

    /**
     * Maximum delay in milliseconds (cap for exponential backoff)
     */
    private long maxDelayMs = 5000;

    /**
     * Sampling temperature sent with every request
     */
    private double temperature = 0.3;

    /**
     * Write raw provider responses to the ai.response.logger logger
     */
    private boolean logResponses = false;
}
