package com.newsrelay.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;

public record NewsItem(
        String canonicalLink,
        String title,
        String summary,
        Instant publishedAt,
        String sourceName,
        String country,
        String category,
        Instant normalizedAt
) {
    // sorts after every real timestamp
    public static final Instant UNKNOWN_PUBLISHED_AT = Instant.MIN;

    public NewsItem {
        Objects.requireNonNull(canonicalLink, "canonicalLink is required");
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(summary, "summary is required");
        Objects.requireNonNull(publishedAt, "publishedAt is required");
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(country, "country is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(normalizedAt, "normalizedAt is required");
    }

    @JsonIgnore
    public boolean hasKnownPublishedAt() {
        return !UNKNOWN_PUBLISHED_AT.equals(publishedAt);
    }
}
