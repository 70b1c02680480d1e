package com.newsrelay.feeds.aggregate;

import com.newsrelay.core.model.NewsItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class Aggregator {
    private Aggregator() {
    }

    public static List<NewsItem> aggregate(
            Collection<NewsItem> items,
            Optional<String> category,
            int limit,
            int perSourceCap
    ) {
        if (limit <= 0 || perSourceCap <= 0 || items.isEmpty()) {
            return List.of();
        }

        Map<String, NewsItem> byLink = new LinkedHashMap<>();
        for (NewsItem item : items) {
            if (category.isPresent() && !category.get().equals(item.category())) {
                continue;
            }
            byLink.merge(item.canonicalLink(), item, Aggregator::fresher);
        }

        List<NewsItem> sorted = new ArrayList<>(byLink.values());
        sorted.sort(NewsItemOrdering.RECENCY);

        Map<String, Integer> takenPerSource = new HashMap<>();
        List<NewsItem> selected = new ArrayList<>(Math.min(limit, sorted.size()));
        for (NewsItem item : sorted) {
            if (selected.size() >= limit) {
                break;
            }
            int taken = takenPerSource.getOrDefault(item.sourceName(), 0);
            if (taken >= perSourceCap) {
                continue;
            }
            takenPerSource.put(item.sourceName(), taken + 1);
            selected.add(item);
        }
        return List.copyOf(selected);
    }

    // later normalization wins; on equal timestamps the later input element wins
    private static NewsItem fresher(NewsItem current, NewsItem candidate) {
        return candidate.normalizedAt().isBefore(current.normalizedAt()) ? current : candidate;
    }
}
