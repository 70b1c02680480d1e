package com.newsrelay.service.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.newsrelay.feeds.FetchSettings;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

public record RelayConfig(
        int dailySendHour,
        int dailySendMinute,
        ZoneId zone,
        boolean scheduledNewsEnabled,
        int concurrencyLimit,
        Duration fetchTimeout,
        Duration cacheTtl,
        Duration cachePurgeInterval,
        int perSourceItemCap,
        int aggregateLimit,
        int digestSize,
        Duration activityWindow,
        Duration deliveryTimeout,
        int deliveryConcurrency,
        int summaryMaxLength,
        String userAgent,
        int apiPort
) {
    public static RelayConfig defaults() {
        return new RelayConfig(
                9,
                0,
                ZoneId.systemDefault(),
                true,
                5,
                Duration.ofSeconds(10),
                Duration.ofMinutes(5),
                Duration.ofMinutes(10),
                3,
                10,
                5,
                Duration.ofDays(30),
                Duration.ofSeconds(30),
                4,
                300,
                "NewsRelay/1.0 (News Digest)",
                8080
        );
    }

    @JsonIgnore
    public LocalTime dailySendTime() {
        return LocalTime.of(dailySendHour, dailySendMinute);
    }

    @JsonIgnore
    public FetchSettings fetchSettings() {
        return new FetchSettings(concurrencyLimit, fetchTimeout, cacheTtl, perSourceItemCap);
    }
}
