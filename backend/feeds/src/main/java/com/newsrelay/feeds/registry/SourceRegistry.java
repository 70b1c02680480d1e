package com.newsrelay.feeds.registry;

import com.newsrelay.core.model.SourceDescriptor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

public final class SourceRegistry {
    private static final SourceRegistry EMPTY = new SourceRegistry(List.of());

    private final List<SourceDescriptor> sources;

    public SourceRegistry(List<SourceDescriptor> sources) {
        this.sources = List.copyOf(new LinkedHashSet<>(sources));
    }

    public static SourceRegistry empty() {
        return EMPTY;
    }

    public List<SourceDescriptor> sourcesFor(Optional<String> country, Optional<String> category) {
        return sources.stream()
                .filter(source -> country.map(source.country()::equals).orElse(true))
                .filter(source -> category.map(source.category()::equals).orElse(true))
                .toList();
    }

    public List<SourceDescriptor> all() {
        return sources;
    }

    public List<String> countries() {
        return sources.stream().map(SourceDescriptor::country).distinct().toList();
    }

    public List<String> categories() {
        return sources.stream().map(SourceDescriptor::category).distinct().toList();
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }
}
