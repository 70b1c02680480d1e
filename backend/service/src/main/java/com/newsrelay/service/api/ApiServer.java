package com.newsrelay.service.api;

import com.newsrelay.core.events.Event;
import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceDescriptor;
import com.newsrelay.core.util.JsonUtils;
import com.newsrelay.feeds.NewsService;
import com.newsrelay.feeds.registry.SourceRegistry;
import com.newsrelay.service.runtime.DailyScheduler;
import com.newsrelay.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    static final int MAX_NEWS_LIMIT = 100;
    static final int DEFAULT_EVENT_LIMIT = 200;

    private final int port;
    private final NewsService newsService;
    private final EventStore eventStore;
    private final StatusTracker statusTracker;
    private final DailyScheduler scheduler;
    private final Clock clock;
    private final int defaultNewsLimit;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            NewsService newsService,
            EventStore eventStore,
            StatusTracker statusTracker,
            DailyScheduler scheduler,
            Clock clock,
            int defaultNewsLimit
    ) {
        this.port = port;
        this.newsService = newsService;
        this.eventStore = eventStore;
        this.statusTracker = statusTracker;
        this.scheduler = scheduler;
        this.clock = clock;
        this.defaultNewsLimit = defaultNewsLimit;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4);
            server.setExecutor(executor);
            server.createContext("/api/health", exchange -> handle(exchange, this::handleHealth));
            server.createContext("/api/news", exchange -> handle(exchange, this::handleNews));
            server.createContext("/api/sources", exchange -> handle(exchange, this::handleSources));
            server.createContext("/api/events", exchange -> handle(exchange, this::handleEvents));
            server.createContext("/api/status", exchange -> handle(exchange, this::handleStatus));
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server on port " + port, e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleNews(HttpExchange exchange) throws IOException {
        int limit;
        Optional<String> category;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : defaultNewsLimit;
            category = Optional.ofNullable(query.get("category")).map(String::trim).filter(value -> !value.isEmpty());
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (limit <= 0 || limit > MAX_NEWS_LIMIT) {
            writeJson(exchange, 400, Map.of("error", "limit must be between 1 and " + MAX_NEWS_LIMIT));
            return;
        }

        List<NewsItem> items = category.isPresent()
                ? newsService.byCategory(category.get(), limit)
                : newsService.latest(limit);
        writeJson(exchange, 200, items.stream().map(ApiServer::newsView).toList());
    }

    private void handleSources(HttpExchange exchange) throws IOException {
        SourceRegistry registry = newsService.registry();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", registry.size());
        body.put("countries", registry.countries());
        body.put("categories", registry.categories());
        body.put("sources", registry.all().stream().map(ApiServer::sourceView).toList());
        writeJson(exchange, 200, body);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : DEFAULT_EVENT_LIMIT;
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }

        List<Event> events = eventStore.query(since, type, Math.max(1, limit));
        writeJson(exchange, 200, events.stream().map(ApiServer::eventView).toList());
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>(statusTracker.snapshot());
        Map<String, Object> schedule = new LinkedHashMap<>();
        DailyScheduler.DailyTrigger trigger = scheduler.trigger();
        schedule.put("trigger", trigger.name());
        schedule.put("enabled", trigger.enabled());
        schedule.put("running", scheduler.isRunning());
        schedule.put("completedRuns", scheduler.completedRuns());
        if (trigger.enabled()) {
            schedule.put("nextRunAt", scheduler.nextFireTime(clock.instant()).toOffsetDateTime().toString());
        }
        body.put("scheduler", schedule);
        writeJson(exchange, 200, body);
    }

    private void handle(HttpExchange exchange, Handler handler) throws IOException {
        try {
            if (!ensureGet(exchange)) {
                return;
            }
            handler.handle(exchange);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Request " + exchange.getRequestURI() + " failed", e);
            writeJson(exchange, 500, Map.of("error", "internal_error"));
        }
    }

    private boolean ensureGet(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private static Map<String, Object> newsView(NewsItem item) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("title", item.title());
        view.put("link", item.canonicalLink());
        view.put("summary", item.summary());
        if (item.hasKnownPublishedAt()) {
            view.put("publishedAt", item.publishedAt().toString());
        }
        view.put("source", item.sourceName());
        view.put("country", item.country());
        view.put("category", item.category());
        return view;
    }

    private static Map<String, Object> eventView(Event event) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("type", event.type());
        view.put("timestamp", event.timestamp().toString());
        view.put("event", event);
        return view;
    }

    private static Map<String, Object> sourceView(SourceDescriptor source) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", source.name());
        view.put("url", source.endpointUrl());
        view.put("country", source.country());
        view.put("category", source.category());
        return view;
    }

    private static Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    @FunctionalInterface
    private interface Handler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
