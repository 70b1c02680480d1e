package com.newsrelay.feeds.aggregate;

import com.newsrelay.core.model.NewsItem;

import java.util.Comparator;

public final class NewsItemOrdering {
    // dated first, newest first, then source name, then link
    public static final Comparator<NewsItem> RECENCY = Comparator
            .comparing(NewsItem::hasKnownPublishedAt, Comparator.reverseOrder())
            .thenComparing(NewsItem::publishedAt, Comparator.reverseOrder())
            .thenComparing(NewsItem::sourceName)
            .thenComparing(NewsItem::canonicalLink);

    private NewsItemOrdering() {
    }
}
