package com.newsrelay.service.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.newsrelay.core.model.DeliveryOutcome;
import com.newsrelay.core.util.JsonUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

public class OutboxDeliveryChannel implements DeliveryChannel {
    private final Path outboxFile;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public OutboxDeliveryChannel(Path outboxFile, Clock clock) {
        this.outboxFile = Objects.requireNonNull(outboxFile, "outboxFile is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public DeliveryOutcome send(String subscriberId, String message) throws DeliveryException {
        String line;
        try {
            line = JsonUtils.objectMapper().writeValueAsString(new OutboxMessage(subscriberId, clock.instant(), message));
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Unable to encode message for " + subscriberId, e);
        }
        lock.lock();
        try {
            Path parent = outboxFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outboxFile, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return DeliveryOutcome.SUCCESS;
        } catch (IOException e) {
            throw new DeliveryException("Failed writing outbox " + outboxFile, e);
        } finally {
            lock.unlock();
        }
    }

    public List<OutboxMessage> messages() {
        lock.lock();
        try {
            if (!Files.exists(outboxFile)) {
                return List.of();
            }
            List<OutboxMessage> messages = new ArrayList<>();
            for (String line : Files.readAllLines(outboxFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    messages.add(JsonUtils.objectMapper().readValue(line, new TypeReference<OutboxMessage>() {
                    }));
                }
            }
            return messages;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading outbox " + outboxFile, e);
        } finally {
            lock.unlock();
        }
    }

    public record OutboxMessage(String subscriberId, Instant sentAt, String message) {
    }
}
