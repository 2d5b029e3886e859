package me.golemcore.mind.port.outbound;

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

import me.golemcore.mind.domain.model.Observation;

import java.util.List;

/**
 * Port for the queue of observed text awaiting learning extraction.
 */
public interface ObservationPort {

    /**
     * Oldest unprocessed observations of a user, at most {@code limit}.
     */
    List<Observation> findUnprocessed(String userId, int limit);

    /**
     * Number of observations of a user still waiting for extraction.
     */
    int countUnprocessed(String userId);

    void markProcessed(String userId, String observationId);
}
