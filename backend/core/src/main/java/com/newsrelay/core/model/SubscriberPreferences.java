package com.newsrelay.core.model;

import java.util.List;

public record SubscriberPreferences(
        String displayName,
        List<String> preferredCategories,
        boolean summariesEnabled
) {
    public SubscriberPreferences {
        displayName = displayName == null ? "" : displayName;
        preferredCategories = preferredCategories == null ? List.of() : List.copyOf(preferredCategories);
    }

    public static SubscriberPreferences defaults() {
        return new SubscriberPreferences("", List.of(), true);
    }
}
