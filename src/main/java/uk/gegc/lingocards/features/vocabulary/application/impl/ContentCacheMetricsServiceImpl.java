package uk.gegc.lingocards.features.vocabulary.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.lingocards.features.vocabulary.application.ContentCacheMetricsService;

@Service
public class ContentCacheMetricsServiceImpl implements ContentCacheMetricsService {

    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter fallbackCounter;

    public ContentCacheMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.cacheHitCounter = Counter.builder("lingocards.content.cache.hits")
                .description("Word lookups served from a cached content card")
                .register(meterRegistry);
        this.cacheMissCounter = Counter.builder("lingocards.content.cache.misses")
                .description("Word lookups that needed a new content card")
                .register(meterRegistry);
        this.fallbackCounter = Counter.builder("lingocards.content.fallbacks")
                .description("Placeholder cards built after a generation failure")
                .register(meterRegistry);
    }

    @Override
    public void incrementCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void incrementCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void incrementFallback() {
        fallbackCounter.increment();
    }
}
