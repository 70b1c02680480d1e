package com.newsrelay.feeds.fetch;

import com.newsrelay.core.model.RawEntry;
import com.newsrelay.core.model.SourceDescriptor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record FetchResult(SourceDescriptor source, List<RawEntry> entries, Optional<FetchFailure> failure) {
    public FetchResult {
        Objects.requireNonNull(source, "source is required");
        entries = List.copyOf(entries);
        Objects.requireNonNull(failure, "failure is required");
    }

    public static FetchResult success(SourceDescriptor source, List<RawEntry> entries) {
        return new FetchResult(source, entries, Optional.empty());
    }

    public static FetchResult failed(SourceDescriptor source, FetchFailure.Kind kind, String message) {
        return new FetchResult(source, List.of(), Optional.of(new FetchFailure(kind, message)));
    }

    public boolean succeeded() {
        return failure.isEmpty();
    }
}
