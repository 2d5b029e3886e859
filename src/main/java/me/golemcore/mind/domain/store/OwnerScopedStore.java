package me.golemcore.mind.domain.store;

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
import me.golemcore.mind.port.outbound.StoragePort;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Base of the knowledge stores. Every collection is a JSON Lines document per
 * owner at {@code <directory>/<userId>/<collection>.jsonl}.
 *
 * <p>
 * Mutations run under a per-owner lock: the document is read, changed in
 * memory and replaced with one atomic write, so concurrent updates of the
 * same owner never lose each other's changes. Owners never share documents,
 * so jobs of different users do not contend.
 */
@Slf4j
public abstract class OwnerScopedStore {

    private static final Pattern USER_ID = Pattern.compile("[A-Za-z0-9._@-]+");
    private static final String JSONL = ".jsonl";

    protected final StoragePort storagePort;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;
    private final String directory;

    private final ConcurrentMap<String, ReentrantLock> ownerLocks = new ConcurrentHashMap<>();

    protected OwnerScopedStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock, String directory) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.directory = directory;
    }

    /**
     * Runs {@code action} while holding the owner's lock. Reentrant, so a
     * locked operation may call other locked operations of the same store.
     */
    protected <R> R withOwnerLock(String userId, Supplier<R> action) {
        ReentrantLock lock = ownerLocks.computeIfAbsent(requireUserId(userId), key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    protected <T> List<T> readCollection(String userId, String collection, Class<T> type) {
        String path = collectionPath(userId, collection);
        String content;
        try {
            content = storagePort.getText(directory, path).join();
        } catch (CompletionException e) {
            throw new KnowledgeStoreException("Failed to read " + directory + "/" + path, e.getCause());
        }
        List<T> items = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return items;
        }
        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                items.add(objectMapper.readValue(line, type));
            } catch (IOException e) {
                log.warn("[KnowledgeStore] Skipping unreadable line in {}/{}: {}", directory, path, e.getMessage());
            }
        }
        return items;
    }

    protected <T> void writeCollection(String userId, String collection, List<T> items) {
        String path = collectionPath(userId, collection);
        StringBuilder payload = new StringBuilder();
        try {
            for (T item : items) {
                payload.append(objectMapper.writeValueAsString(item)).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new KnowledgeStoreException("Failed to serialize " + collection + " of " + userId, e);
        }
        try {
            storagePort.putTextAtomic(directory, path, payload.toString(), false).join();
        } catch (CompletionException e) {
            throw new KnowledgeStoreException("Failed to write " + directory + "/" + path, e.getCause());
        }
        log.trace("[KnowledgeStore] Wrote {} {} item(s) for {}", items.size(), collection, userId);
    }

    /**
     * Finds which owner holds an entity, scanning every owner's collection.
     * Only used on the miss path to tell "missing" from "not yours".
     */
    protected <T> Optional<String> findOwner(String collection, Class<T> type, Function<T, String> idOf, String id) {
        List<String> files;
        try {
            files = storagePort.listObjects(directory, "").join();
        } catch (CompletionException e) {
            throw new KnowledgeStoreException("Failed to list " + directory, e.getCause());
        }
        String suffix = "/" + collection + JSONL;
        for (String file : files) {
            if (!file.endsWith(suffix)) {
                continue;
            }
            String owner = file.substring(0, file.length() - suffix.length());
            if (!USER_ID.matcher(owner).matches()) {
                continue;
            }
            boolean holds = readCollection(owner, collection, type).stream()
                    .anyMatch(item -> id.equals(idOf.apply(item)));
            if (holds) {
                return Optional.of(owner);
            }
        }
        return Optional.empty();
    }

    /**
     * Exception for an id missing from the caller's collection: access denied
     * when another owner holds it, not found otherwise.
     */
    protected <T> RuntimeException missing(String kind, String collection, Class<T> type, Function<T, String> idOf,
            String id) {
        if (id != null && findOwner(collection, type, idOf, id).isPresent()) {
            return new KnowledgeAccessDeniedException(kind, id);
        }
        return new KnowledgeNotFoundException(kind, id);
    }

    protected String newId() {
        return UUID.randomUUID().toString();
    }

    protected Instant now() {
        return clock.instant();
    }

    protected static String requireUserId(String userId) {
        if (userId == null || !USER_ID.matcher(userId).matches() || userId.chars().allMatch(ch -> ch == '.')) {
            throw new IllegalArgumentException("Invalid user id: " + userId);
        }
        return userId;
    }

    protected static <T> List<T> page(List<T> sorted, int offset, int limit) {
        int from = Math.min(Math.max(offset, 0), sorted.size());
        int to = Math.min(from + Math.max(limit, 0), sorted.size());
        return new ArrayList<>(sorted.subList(from, to));
    }

    private String collectionPath(String userId, String collection) {
        return requireUserId(userId) + "/" + collection + JSONL;
    }
}
