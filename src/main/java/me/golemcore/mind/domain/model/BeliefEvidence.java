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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Evidence attached to a belief: a memory or learning that supports or
 * contradicts it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BeliefEvidence {

    public enum Type {
        DIRECT, INFERRED, LEARNED, VALIDATED, CONTRADICTED
    }

    private String id;
    private String beliefId;
    private String memoryId;
    private String learningId;
    private Type evidenceType;
    private boolean supports;
    private double strength;
    private String notes;
    private Instant createdAt;
}
