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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mind.domain.model.SessionContext;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Holds the single current session context of each owner.
 */
@Service
public class SessionContextStore extends OwnerScopedStore {

    static final String CONTEXT = "session-context";

    public SessionContextStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            MindProperties properties) {
        super(storagePort, objectMapper, clock, properties.getStorage().getKnowledgeDirectory());
    }

    /**
     * Replaces whatever context the owner had. Nothing of the previous
     * snapshot is kept.
     */
    public SessionContext replace(SessionContext context) {
        String userId = context.getUserId();
        return withOwnerLock(userId, () -> {
            writeCollection(userId, CONTEXT, List.of(context));
            return context;
        });
    }

    /**
     * The owner's context unless it is missing or expired.
     */
    public Optional<SessionContext> current(String userId) {
        return readCollection(userId, CONTEXT, SessionContext.class).stream()
                .findFirst()
                .filter(context -> !context.isExpiredAt(now()));
    }
}
