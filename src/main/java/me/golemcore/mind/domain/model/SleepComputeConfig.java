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

import java.time.Duration;

/**
 * Immutable tuning of one sleep compute engine instance.
 */
@Value
@Builder(toBuilder = true)
public class SleepComputeConfig {

    @Builder.Default
    int maxObservationsPerRun = 200;

    @Builder.Default
    int minObservationsPerRun = 3;

    @Builder.Default
    int maxLearningsForBeliefs = 100;

    @Builder.Default
    double beliefFormationMinConfidence = 0.7;

    @Builder.Default
    int maxOutcomesToPropagate = 50;

    @Builder.Default
    int decayStartDays = 30;

    @Builder.Default
    double decayRate = 0.02;

    @Builder.Default
    int decayBatchLimit = 200;

    @Builder.Default
    double archivalThreshold = 0.15;

    @Builder.Default
    int archivalDays = 90;

    @Builder.Default
    int outcomeRetentionDays = 180;

    @Builder.Default
    double conflictResolutionGap = 0.3;

    @Builder.Default
    Duration timeBudget = Duration.ofMillis(25_000);

    @Builder.Default
    int sessionPrepLimit = 20;

    @Builder.Default
    int sessionContextItems = 10;

    @Builder.Default
    Duration sessionTtl = Duration.ofHours(24);

    public static SleepComputeConfig defaults() {
        return SleepComputeConfig.builder().build();
    }
}
