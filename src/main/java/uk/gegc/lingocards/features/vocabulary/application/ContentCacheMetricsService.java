package uk.gegc.lingocards.features.vocabulary.application;

/**
 * Counters for the content card cache.
 */
public interface ContentCacheMetricsService {

    void incrementCacheHit();

    void incrementCacheMiss();

    /**
     * A placeholder card was built because generation failed.
     */
    void incrementFallback();
}
