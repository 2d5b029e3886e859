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

import me.golemcore.mind.domain.model.ExtractedFact;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the external backend that turns observed text into structured
 * facts about the user. Failures complete the future exceptionally with a
 * {@link FactExtractionException}.
 */
public interface FactExtractionPort {

    CompletableFuture<List<ExtractedFact>> extract(String text);

    /**
     * Whether a backend is configured. The sleep engine skips extraction when
     * it is not.
     */
    default boolean isAvailable() {
        return true;
    }
}
