package com.newsrelay.service.broadcast;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.Subscriber;
import com.newsrelay.core.model.SubscriberPreferences;
import com.newsrelay.core.util.TextUtils;

import java.util.ArrayList;
import java.util.List;

public class DigestRenderer {
    public static final int MAX_MESSAGE_LENGTH = 4096;
    static final int SUMMARY_CLIP = 80;
    static final String NO_NEWS = "No news is available right now. Please check back later.";

    public String render(Subscriber subscriber, List<NewsItem> items) {
        SubscriberPreferences preferences = subscriber.preferences();
        String greeting = greeting(preferences.displayName());
        List<NewsItem> selected = preferredOrAll(items, preferences.preferredCategories());
        if (selected.isEmpty()) {
            return greeting + "\n\n" + NO_NEWS;
        }

        List<String> blocks = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            blocks.add(block(i + 1, selected.get(i), preferences.summariesEnabled()));
        }
        // drop trailing items until the message fits
        while (blocks.size() > 1 && join(greeting, blocks).length() > MAX_MESSAGE_LENGTH) {
            blocks.remove(blocks.size() - 1);
        }
        return TextUtils.truncate(join(greeting, blocks), MAX_MESSAGE_LENGTH);
    }

    static List<NewsItem> preferredOrAll(List<NewsItem> items, List<String> preferredCategories) {
        if (preferredCategories.isEmpty()) {
            return items;
        }
        List<NewsItem> preferred = items.stream()
                .filter(item -> preferredCategories.contains(item.category()))
                .toList();
        return preferred.isEmpty() ? items : preferred;
    }

    private static String greeting(String displayName) {
        String name = displayName == null ? "" : displayName.trim();
        return name.isEmpty()
                ? "Good morning! Here is your daily news."
                : "Good morning, " + name + "! Here is your daily news.";
    }

    private static String block(int number, NewsItem item, boolean withSummary) {
        StringBuilder text = new StringBuilder()
                .append(number).append(". ").append(item.title()).append('\n')
                .append("Source: ").append(item.sourceName()).append('\n');
        if (withSummary && !item.summary().isBlank()) {
            text.append(TextUtils.truncate(item.summary(), SUMMARY_CLIP)).append('\n');
        }
        return text.append("Read: ").append(item.canonicalLink()).toString();
    }

    private static String join(String greeting, List<String> blocks) {
        return greeting + "\n\n" + String.join("\n\n", blocks);
    }
}
