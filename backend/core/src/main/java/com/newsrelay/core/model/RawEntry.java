package com.newsrelay.core.model;

public record RawEntry(
        String title,
        String link,
        String summary,
        String published
) {
}
