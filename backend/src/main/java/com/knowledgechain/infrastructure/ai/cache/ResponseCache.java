package com.knowledgechain.infrastructure.ai.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-lifetime LLM response cache keyed by exact prompt text.
 * <p>
 * The key deliberately ignores sampling temperature: a prompt answered once at any temperature is
 * served from cache at every other temperature. Entries are never evicted or overwritten.
 * </p>
 */
public class ResponseCache {

    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    public Optional<String> get(String prompt) {
        return Optional.ofNullable(entries.get(prompt));
    }

    /**
     * Store a response unless one is already present. Returns the cached value.
     */
    public String putIfAbsent(String prompt, String response) {
        String existing = entries.putIfAbsent(prompt, response);
        return existing != null ? existing : response;
    }

    public int size() {
        return entries.size();
    }
}
