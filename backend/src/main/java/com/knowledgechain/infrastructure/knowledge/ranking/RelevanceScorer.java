package com.knowledgechain.infrastructure.knowledge.ranking;

import com.knowledgechain.domain.answer.model.KnowledgeItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores retrieved snippets against the query that produced them.
 * <p>
 * score = 0.4 * word overlap + substring bonus (0.3 exact, 0.15 partial) + 0.3 * sequence similarity,
 * clamped to [0, 1].
 * </p>
 */
@Component
public class RelevanceScorer {

    static final double OVERLAP_WEIGHT = 0.4;
    static final double EXACT_MATCH_BONUS = 0.3;
    static final double PARTIAL_MATCH_BONUS = 0.15;
    static final double SIMILARITY_WEIGHT = 0.3;
    static final int SIMILARITY_WINDOW = 500;
    static final int MIN_PARTIAL_WORD_LENGTH = 4;

    public static final String UNKNOWN_SOURCE = "unknown";

    public List<KnowledgeItem> score(String query, List<String> items) {
        return score(query, items, UNKNOWN_SOURCE);
    }

    /**
     * @return items sorted by descending score; ties keep their input order
     */
    public List<KnowledgeItem> score(String query, List<String> items, String source) {
        List<KnowledgeItem> scored = new ArrayList<>(items.size());
        for (String item : items) {
            scored.add(new KnowledgeItem(item, scoreOne(query, item), source));
        }
        return sortByScore(scored);
    }

    public double scoreOne(String query, String content) {
        if (content == null || content.isBlank() || query == null || query.isBlank()) {
            return 0.0;
        }
        String queryLower = query.toLowerCase(Locale.ROOT).strip();
        String contentLower = content.toLowerCase(Locale.ROOT);

        Set<String> queryWords = words(queryLower);
        Set<String> contentWords = words(contentLower);
        double overlap = 0.0;
        if (!queryWords.isEmpty()) {
            long shared = queryWords.stream().filter(contentWords::contains).count();
            overlap = (double) shared / queryWords.size();
        }

        double bonus = 0.0;
        if (contentLower.contains(queryLower)) {
            bonus = EXACT_MATCH_BONUS;
        } else if (queryWords.stream()
                .anyMatch(w -> w.length() >= MIN_PARTIAL_WORD_LENGTH && contentLower.contains(w))) {
            bonus = PARTIAL_MATCH_BONUS;
        }

        String window = contentLower.length() > SIMILARITY_WINDOW
                ? contentLower.substring(0, SIMILARITY_WINDOW)
                : contentLower;
        double similarity = SequenceSimilarity.ratio(queryLower, window);

        double score = OVERLAP_WEIGHT * overlap + bonus + SIMILARITY_WEIGHT * similarity;
        return Math.max(0.0, Math.min(1.0, score));
    }

    public List<KnowledgeItem> filterByThreshold(List<KnowledgeItem> items, double threshold) {
        return items.stream()
                .filter(item -> item.score() >= threshold)
                .toList();
    }

    public List<KnowledgeItem> topK(List<KnowledgeItem> items, int k) {
        return items.stream()
                .limit(Math.max(0, k))
                .toList();
    }

    public List<KnowledgeItem> sortByScore(List<KnowledgeItem> items) {
        List<KnowledgeItem> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparingDouble(KnowledgeItem::score).reversed());
        return sorted;
    }

    private static Set<String> words(String text) {
        Set<String> words = new HashSet<>(Arrays.asList(text.split("\\s+")));
        words.remove("");
        return words;
    }
}
