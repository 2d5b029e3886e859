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

import lombok.Builder;
import lombok.Value;

/**
 * Options for one belief formation pass. A null {@code minConfidence} means
 * the service default.
 */
@Value
@Builder(toBuilder = true)
public class FormationOptions {

    Double minConfidence;

    @Builder.Default
    int maxLearnings = 100;

    @Builder.Default
    int offset = 0;

    LearningCategory category;

    public static FormationOptions defaults() {
        return FormationOptions.builder().build();
    }
}
