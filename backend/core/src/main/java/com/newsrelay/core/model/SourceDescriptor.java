package com.newsrelay.core.model;

import java.util.Objects;

public record SourceDescriptor(
        String name,
        String endpointUrl,
        String country,
        String category
) {
    public SourceDescriptor {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(endpointUrl, "endpointUrl is required");
        Objects.requireNonNull(country, "country is required");
        Objects.requireNonNull(category, "category is required");
    }

    // Identity is the endpoint URL; two catalog rows pointing at the same feed are one source.
    @Override
    public boolean equals(Object other) {
        return other instanceof SourceDescriptor that && endpointUrl.equals(that.endpointUrl);
    }

    @Override
    public int hashCode() {
        return endpointUrl.hashCode();
    }
}
