package com.newsrelay.service.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsrelay.core.util.JsonUtils;
import com.newsrelay.feeds.registry.SourceCatalogLoader;
import com.newsrelay.feeds.registry.SourceRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    static final String RELAY_FILE = "relay.json";
    static final String SOURCES_FILE = "sources.json";

    private ConfigLoader() {
    }

    public static RelayConfig loadRelay(Path configDir) {
        return loadRelay(configDir, System.getenv());
    }

    // defaults, then relay.json, then environment variables
    public static RelayConfig loadRelay(Path configDir, Map<String, String> environment) {
        ObjectMapper mapper = JsonUtils.objectMapper();
        ObjectNode merged = mapper.valueToTree(RelayConfig.defaults());
        Path file = configDir.resolve(RELAY_FILE);
        if (Files.exists(file)) {
            JsonNode fromFile = read(file);
            if (!fromFile.isObject()) {
                throw new IllegalStateException("Failed loading config from " + file + ": expected a JSON object");
            }
            merged.setAll((ObjectNode) fromFile);
        } else {
            LOGGER.info("No " + file + " found; using default settings");
        }
        applyEnvironment(merged, environment);

        RelayConfig config;
        try {
            config = mapper.treeToValue(merged, RelayConfig.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed loading config from " + file + ": " + e.getOriginalMessage(), e);
        }
        validate(config);
        return config;
    }

    public static SourceRegistry loadSources(Path configDir) {
        return SourceCatalogLoader.load(configDir.resolve(SOURCES_FILE));
    }

    static void validate(RelayConfig config) {
        requireRange("dailySendHour", config.dailySendHour(), 0, 23);
        requireRange("dailySendMinute", config.dailySendMinute(), 0, 59);
        if (config.zone() == null) {
            throw invalid("zone", "must be set");
        }
        requirePositive("concurrencyLimit", config.concurrencyLimit());
        requirePositive("fetchTimeout", config.fetchTimeout());
        if (config.cacheTtl() == null || config.cacheTtl().isNegative()) {
            throw invalid("cacheTtl", "must not be negative");
        }
        requirePositive("cachePurgeInterval", config.cachePurgeInterval());
        requirePositive("perSourceItemCap", config.perSourceItemCap());
        requirePositive("aggregateLimit", config.aggregateLimit());
        requirePositive("digestSize", config.digestSize());
        requirePositive("activityWindow", config.activityWindow());
        requirePositive("deliveryTimeout", config.deliveryTimeout());
        requirePositive("deliveryConcurrency", config.deliveryConcurrency());
        if (config.summaryMaxLength() <= 3) {
            throw invalid("summaryMaxLength", "must be greater than 3");
        }
        if (config.userAgent() == null || config.userAgent().isBlank()) {
            throw invalid("userAgent", "must not be blank");
        }
        requireRange("apiPort", config.apiPort(), 0, 65535);
    }

    private static void applyEnvironment(ObjectNode merged, Map<String, String> environment) {
        overrideInt(merged, environment, "DAILY_NEWS_HOUR", "dailySendHour");
        overrideInt(merged, environment, "DAILY_NEWS_MINUTE", "dailySendMinute");
        overrideInt(merged, environment, "MAX_CONCURRENT_FETCHES", "concurrencyLimit");
        overrideSeconds(merged, environment, "RSS_TIMEOUT", "fetchTimeout");
        overrideSeconds(merged, environment, "CACHE_DURATION", "cacheTtl");
        overrideInt(merged, environment, "RSS_MAX_ITEMS_PER_SOURCE", "perSourceItemCap");
        overrideInt(merged, environment, "MAX_NEWS_ITEMS", "aggregateLimit");
        overrideInt(merged, environment, "API_PORT", "apiPort");

        String scheduled = environment.get("ENABLE_SCHEDULED_NEWS");
        if (scheduled != null) {
            String value = scheduled.trim().toLowerCase(Locale.ROOT);
            if (!"true".equals(value) && !"false".equals(value)) {
                throw invalid("ENABLE_SCHEDULED_NEWS", "expected true or false but was '" + scheduled + "'");
            }
            merged.put("scheduledNewsEnabled", Boolean.parseBoolean(value));
        }
        String userAgent = environment.get("RSS_USER_AGENT");
        if (userAgent != null && !userAgent.isBlank()) {
            merged.put("userAgent", userAgent.trim());
        }
    }

    private static void overrideInt(ObjectNode merged, Map<String, String> environment, String variable, String key) {
        String raw = environment.get(variable);
        if (raw == null) {
            return;
        }
        merged.put(key, parseInt(variable, raw));
    }

    private static void overrideSeconds(ObjectNode merged, Map<String, String> environment, String variable, String key) {
        String raw = environment.get(variable);
        if (raw == null) {
            return;
        }
        merged.put(key, Duration.ofSeconds(parseInt(variable, raw)).toString());
    }

    private static int parseInt(String variable, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw invalid(variable, "expected an integer but was '" + raw + "'");
        }
    }

    private static JsonNode read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static void requireRange(String key, int value, int min, int max) {
        if (value < min || value > max) {
            throw invalid(key, "must be between " + min + " and " + max + " but was " + value);
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw invalid(key, "must be positive but was " + value);
        }
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw invalid(key, "must be a positive duration but was " + value);
        }
    }

    private static IllegalStateException invalid(String key, String problem) {
        return new IllegalStateException("Invalid configuration " + key + ": " + problem);
    }
}
