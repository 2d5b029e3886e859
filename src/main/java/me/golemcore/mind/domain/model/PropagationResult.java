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
 * Confidence changes caused by propagating one outcome.
 */
public record PropagationResult(String outcomeId, OutcomeSignal signal, List<ConfidenceChange> learningsUpdated,
        List<ConfidenceChange> beliefsUpdated, boolean propagated) {

    public static PropagationResult noop(String outcomeId, OutcomeSignal signal) {
        return new PropagationResult(outcomeId, signal, List.of(), List.of(), false);
    }

    public int totalSourcesUpdated() {
        return learningsUpdated.size() + beliefsUpdated.size();
    }
}
