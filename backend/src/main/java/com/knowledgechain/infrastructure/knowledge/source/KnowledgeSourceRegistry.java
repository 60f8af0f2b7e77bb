package com.knowledgechain.infrastructure.knowledge.source;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named lookup over the enabled knowledge sources, in registration order.
 */
@Slf4j
@Component
public class KnowledgeSourceRegistry {

    private final Map<String, KnowledgeSource> sources = new LinkedHashMap<>();

    @Autowired
    public KnowledgeSourceRegistry(ObjectProvider<KnowledgeSource> knowledgeSources) {
        this(knowledgeSources.orderedStream().toList());
    }

    public KnowledgeSourceRegistry(List<KnowledgeSource> knowledgeSources) {
        for (KnowledgeSource source : knowledgeSources) {
            if (sources.putIfAbsent(source.name(), source) != null) {
                throw new IllegalStateException("Duplicate knowledge source name: " + source.name());
            }
            log.info("[Knowledge] registered source: {}", source.name());
        }
        if (sources.isEmpty()) {
            log.warn("[Knowledge] no knowledge sources enabled; retrieval will always come back empty");
        }
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(sources.keySet());
    }

    public Optional<KnowledgeSource> get(String name) {
        return Optional.ofNullable(sources.get(name));
    }

}
