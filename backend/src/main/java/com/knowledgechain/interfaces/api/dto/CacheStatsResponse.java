package com.knowledgechain.interfaces.api.dto;

public record CacheStatsResponse(
        int cachedResponses,
        long cacheHits,
        long cacheMisses,
        double cacheHitRatePercent,
        long providerCalls,
        long rateLimitRetries
) {}
