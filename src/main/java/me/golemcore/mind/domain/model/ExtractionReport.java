package me.golemcore.mind.domain.model;

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

import java.util.List;

/**
 * Counters for one observation run through extraction and consolidation.
 */
public record ExtractionReport(String observationId, String skipReason, int factsExtracted, int created,
        int reinforced, int contradicted, int failed, List<PendingLearningConflict> conflicts) {

    public static ExtractionReport skipped(String observationId, String reason) {
        return new ExtractionReport(observationId, reason, 0, 0, 0, 0, 0, List.of());
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
