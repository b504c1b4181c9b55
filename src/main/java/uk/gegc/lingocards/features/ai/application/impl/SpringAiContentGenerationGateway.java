package uk.gegc.lingocards.features.ai.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.lingocards.features.ai.application.ContentGenerationGateway;
import uk.gegc.lingocards.features.ai.application.GeneratedContent;
import uk.gegc.lingocards.features.ai.application.GenerationRequest;
import uk.gegc.lingocards.features.ai.application.PromptTemplateService;
import uk.gegc.lingocards.features.ai.infra.parser.GeneratedContentParser;
import uk.gegc.lingocards.shared.config.GenerationProperties;
import uk.gegc.lingocards.shared.exception.AIResponseParseException;
import uk.gegc.lingocards.shared.exception.ContentGenerationException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Content generation backed by a Spring AI {@link ChatClient}. Every provider round trip
 * runs on the AI executor and is bounded by the configured timeout.
 */
@Service
@Slf4j
public class SpringAiContentGenerationGateway implements ContentGenerationGateway {

    private static final Logger responseLog = LoggerFactory.getLogger("ai.response.logger");

    private final ChatClient chatClient;
    private final PromptTemplateService promptTemplateService;
    private final GeneratedContentParser parser;
    private final GenerationProperties properties;
    private final Executor aiTaskExecutor;

    public SpringAiContentGenerationGateway(ChatClient chatClient,
                                            PromptTemplateService promptTemplateService,
                                            GeneratedContentParser parser,
                                            GenerationProperties properties,
                                            @Qualifier("aiTaskExecutor") Executor aiTaskExecutor) {
        this.chatClient = chatClient;
        this.promptTemplateService = promptTemplateService;
        this.parser = parser;
        this.properties = properties;
        this.aiTaskExecutor = aiTaskExecutor;
    }

    @Override
    public GeneratedContent generate(GenerationRequest request) {
        String systemPrompt = promptTemplateService.buildSystemPrompt();
        String userPrompt = promptTemplateService.buildWordLookupPrompt(request);
        log.debug("Word lookup prompt for '{}': {}", request.wordText(), userPrompt);

        Prompt prompt = new Prompt(
                List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)),
                ChatOptions.builder().temperature(properties.getTemperature()).build()
        );

        int maxRetries = Math.max(1, properties.getMaxRetries());
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                String raw = callWithTimeout(prompt);
                if (properties.isLogResponses()) {
                    responseLog.info("word='{}' level={} interest='{}' response={}",
                            request.wordText(), request.context().cefrLevel(),
                            request.context().interestContext(), raw);
                }
                GeneratedContent content = parser.parse(raw, request);
                log.info("Generated content for '{}' (level={}, interest='{}', attempt {})",
                        request.wordText(), content.resolvedLevel(), content.selectedInterest(), attempt + 1);
                return content;
            } catch (AIResponseParseException e) {
                log.warn("Unusable response for '{}': {}", request.wordText(), e.getMessage());
                throw e;
            } catch (ContentGenerationException e) {
                // a timed out call already used the whole budget
                if (e.getCause() instanceof TimeoutException || attempt >= maxRetries - 1) {
                    throw e;
                }
                long delayMs = calculateBackoffDelay(attempt);
                log.warn("Generation attempt {} for '{}' failed: {}. Retrying in {} ms",
                        attempt + 1, request.wordText(), e.getMessage(), delayMs);
                sleepForBackoff(delayMs);
            }
        }

        throw new ContentGenerationException("Failed to generate content after " + maxRetries + " attempts");
    }

    private String callWithTimeout(Prompt prompt) {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> call(prompt), aiTaskExecutor);
        long timeoutMs = properties.getTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ContentGenerationException("Generation provider timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ContentGenerationException("Interrupted while waiting for generation provider", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ContentGenerationException generationException) {
                throw generationException;
            }
            throw new ContentGenerationException("Generation provider error: " + cause.getMessage(), cause);
        }
    }

    private String call(Prompt prompt) {
        ChatResponse response = chatClient.prompt(prompt)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new ContentGenerationException("No response received from generation provider");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new ContentGenerationException("Empty response received from generation provider");
        }
        return text;
    }

    long calculateBackoffDelay(int attempt) {
        long exponentialDelay = properties.getBaseDelayMs() * (1L << Math.min(attempt, 20));
        return Math.min(exponentialDelay, properties.getMaxDelayMs());
    }

    /**
     * Sleep between attempts. Overridden in tests to avoid actual sleeping.
     */
    protected void sleepForBackoff(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ContentGenerationException("Interrupted while waiting to retry generation", ie);
        }
    }
}
