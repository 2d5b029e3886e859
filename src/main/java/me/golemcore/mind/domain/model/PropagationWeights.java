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

/**
 * Base confidence changes applied per feedback signal, the noise floor below
 * which a change is skipped and the cap on any single change.
 */
public record PropagationWeights(double positiveChange, double negativeChange, double minChange, double maxChange) {

    public static PropagationWeights defaults() {
        return new PropagationWeights(0.05, -0.08, 0.01, 0.15);
    }
}
