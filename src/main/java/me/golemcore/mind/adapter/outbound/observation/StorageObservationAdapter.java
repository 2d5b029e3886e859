package me.golemcore.mind.adapter.outbound.observation;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mind.domain.model.Observation;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.ObservationPort;
import me.golemcore.mind.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Observation queue kept as one JSONL file per user at
 * {@code observations/<userId>/pending.jsonl}.
 *
 * <p>
 * New observations are appended; processed ones are removed by rewriting the
 * file atomically. Both happen under the user's lock.
 */
@Component
@Slf4j
public class StorageObservationAdapter implements ObservationPort {

    static final String PENDING_FILE = "pending.jsonl";
    private static final Pattern USER_ID = Pattern.compile("[A-Za-z0-9._@-]+");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String directory;

    private final ConcurrentMap<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    public StorageObservationAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            MindProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = properties.getStorage().getObservationsDirectory();
    }

    /**
     * Queues observed text for the next learning extraction run.
     */
    public Observation enqueue(String userId, String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Observation content is required");
        }
        Observation observation = Observation.builder()
                .id(UUID.randomUUID().toString())
                .userId(requireUserId(userId))
                .content(content)
                .createdAt(clock.instant())
                .build();
        String line;
        try {
            line = objectMapper.writeValueAsString(observation) + "\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize observation", e);
        }
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            storagePort.appendText(directory, pathFor(userId), line).join();
        } finally {
            lock.unlock();
        }
        log.debug("[Observations] Queued observation {} for {}", observation.getId(), userId);
        return observation;
    }

    @Override
    public List<Observation> findUnprocessed(String userId, int limit) {
        return readAll(userId).stream()
                .sorted(Comparator.comparing(Observation::getCreatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(Math.max(limit, 0))
                .toList();
    }

    @Override
    public int countUnprocessed(String userId) {
        return readAll(userId).size();
    }

    @Override
    public void markProcessed(String userId, String observationId) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            List<Observation> pending = readAll(userId);
            List<Observation> remaining = new ArrayList<>(pending.size());
            for (Observation observation : pending) {
                if (!observation.getId().equals(observationId)) {
                    remaining.add(observation);
                }
            }
            if (remaining.size() == pending.size()) {
                log.debug("[Observations] Observation {} of {} already processed", observationId, userId);
                return;
            }
            StringBuilder payload = new StringBuilder();
            for (Observation observation : remaining) {
                payload.append(objectMapper.writeValueAsString(observation)).append('\n');
            }
            storagePort.putTextAtomic(directory, pathFor(userId), payload.toString(), false).join();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to rewrite observation queue of " + userId, e);
        } finally {
            lock.unlock();
        }
    }

    private List<Observation> readAll(String userId) {
        String content = storagePort.getText(directory, pathFor(userId)).join();
        List<Observation> observations = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return observations;
        }
        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                Observation observation = objectMapper.readValue(line, Observation.class);
                if (observation.getId() != null) {
                    observations.add(observation);
                }
            } catch (IOException e) {
                log.warn("[Observations] Skipping unreadable queue entry of {}: {}", userId, e.getMessage());
            }
        }
        return observations;
    }

    private ReentrantLock lockFor(String userId) {
        return userLocks.computeIfAbsent(requireUserId(userId), key -> new ReentrantLock());
    }

    private static String pathFor(String userId) {
        return requireUserId(userId) + "/" + PENDING_FILE;
    }

    private static String requireUserId(String userId) {
        if (userId == null || !USER_ID.matcher(userId).matches() || userId.chars().allMatch(ch -> ch == '.')) {
            throw new IllegalArgumentException("Invalid user id: " + userId);
        }
        return userId;
    }
}
