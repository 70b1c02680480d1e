package com.newsrelay.feeds.normalize;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.RawEntry;
import com.newsrelay.core.model.SourceDescriptor;

import java.time.Clock;
import java.util.Objects;

public class Normalizer {
    static final String UNTITLED = "(untitled)";

    private final TextCleaner textCleaner;
    private final Clock clock;

    public Normalizer(TextCleaner textCleaner, Clock clock) {
        this.textCleaner = Objects.requireNonNull(textCleaner, "textCleaner is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    // the trimmed link is the identity; callers drop blank links
    public NewsItem normalize(RawEntry entry, SourceDescriptor source) {
        String title = textCleaner.flatten(entry.title());
        return new NewsItem(
                entry.link() == null ? "" : entry.link().trim(),
                title.isEmpty() ? UNTITLED : title,
                textCleaner.clean(entry.summary()),
                DateNormalizer.parse(entry.published()),
                source.name(),
                source.country(),
                source.category(),
                clock.instant()
        );
    }
}
