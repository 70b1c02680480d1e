package com.newsrelay.feeds.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.newsrelay.core.model.SourceDescriptor;
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class SourceCatalogLoader {
    private static final Logger LOGGER = Logger.getLogger(SourceCatalogLoader.class.getName());

    private SourceCatalogLoader() {
    }

    public static SourceRegistry load(Path catalogFile) {
        if (!Files.exists(catalogFile)) {
            LOGGER.warning("Source catalog not found at " + catalogFile + "; starting with no sources");
            return SourceRegistry.empty();
        }
        try (InputStream in = Files.newInputStream(catalogFile)) {
            return fromTree(JsonUtils.objectMapper().readTree(in));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Source catalog " + catalogFile + " is unreadable; starting with no sources", e);
            return SourceRegistry.empty();
        }
    }

    public static SourceRegistry parse(String json) {
        try {
            return fromTree(JsonUtils.objectMapper().readTree(json));
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Source catalog is malformed; starting with no sources", e);
            return SourceRegistry.empty();
        }
    }

    static SourceRegistry fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            LOGGER.warning("Source catalog root must be an object of countries; starting with no sources");
            return SourceRegistry.empty();
        }
        List<SourceDescriptor> sources = new ArrayList<>();
        Set<String> seenUrls = new LinkedHashSet<>();
        Iterator<Map.Entry<String, JsonNode>> countries = root.fields();
        while (countries.hasNext()) {
            Map.Entry<String, JsonNode> country = countries.next();
            if (!country.getValue().isObject()) {
                LOGGER.warning("Dropping country '" + country.getKey() + "': expected an object of categories");
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> categories = country.getValue().fields();
            while (categories.hasNext()) {
                Map.Entry<String, JsonNode> category = categories.next();
                if (!category.getValue().isArray()) {
                    LOGGER.warning("Dropping category '" + country.getKey() + "/" + category.getKey() + "': expected a list of sources");
                    continue;
                }
                for (JsonNode record : category.getValue()) {
                    toDescriptor(record, country.getKey(), category.getKey())
                            .filter(descriptor -> {
                                if (seenUrls.add(descriptor.endpointUrl())) {
                                    return true;
                                }
                                LOGGER.warning("Dropping duplicate source url " + descriptor.endpointUrl());
                                return false;
                            })
                            .ifPresent(sources::add);
                }
            }
        }
        LOGGER.info("Loaded " + sources.size() + " sources from catalog");
        return new SourceRegistry(sources);
    }

    private static Optional<SourceDescriptor> toDescriptor(JsonNode record, String country, String category) {
        String name = record.path("name").asText("").trim();
        String url = record.path("url").asText("").trim();
        if (name.isEmpty() || !isFetchableUrl(url)) {
            LOGGER.warning("Dropping invalid source record in " + country + "/" + category + ": " + record);
            return Optional.empty();
        }
        return Optional.of(new SourceDescriptor(name, url, country, category));
    }

    private static boolean isFetchableUrl(String url) {
        if (url.isEmpty()) {
            return false;
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            return ("http".equals(scheme) || "https".equals(scheme)) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
