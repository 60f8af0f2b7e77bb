package com.knowledgechain.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class CacheMetricsTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong providerCalls = new AtomicLong();
    private final AtomicLong rateLimitRetries = new AtomicLong();

    public void recordHit() {
        totalRequests.incrementAndGet();
        cacheHits.incrementAndGet();
        log.debug("Gateway cache hit - cumulative: totalRequests={}, hitRate={}%",
                totalRequests.get(), String.format("%.1f", getCacheHitRate()));
    }

    public void recordMiss() {
        totalRequests.incrementAndGet();
    }

    public void recordProviderCall() {
        providerCalls.incrementAndGet();
    }

    public void recordRateLimitRetry() {
        rateLimitRetries.incrementAndGet();
    }

    public double getCacheHitRate() {
        long total = totalRequests.get();
        return total > 0 ? (double) cacheHits.get() / total * 100 : 0;
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getProviderCalls() {
        return providerCalls.get();
    }

    public long getRateLimitRetries() {
        return rateLimitRetries.get();
    }
}
