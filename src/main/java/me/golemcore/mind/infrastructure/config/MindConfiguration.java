package me.golemcore.mind.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mind.domain.model.PropagationWeights;
import me.golemcore.mind.domain.model.SimilarityThresholds;
import me.golemcore.mind.domain.model.SleepComputeConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared infrastructure beans: clock, JSON mapper and the immutable engine
 * tuning objects built from {@link MindProperties}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class MindConfiguration {

    private final MindProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public SleepComputeConfig sleepComputeConfig() {
        return toSleepComputeConfig(properties.getSleep());
    }

    @Bean
    public PropagationWeights propagationWeights() {
        MindProperties.FeedbackProperties feedback = properties.getFeedback();
        return new PropagationWeights(feedback.getPositiveChange(), feedback.getNegativeChange(),
                feedback.getMinChange(), feedback.getMaxChange());
    }

    @Bean
    public SimilarityThresholds similarityThresholds() {
        MindProperties.SimilarityProperties similarity = properties.getSimilarity();
        return new SimilarityThresholds(similarity.getMinTokenLength(), similarity.getDuplicateOverlap(),
                similarity.getContradictionOverlap(), similarity.getTemporalOverlap(),
                similarity.getLearningKeywordMatches(), similarity.getBeliefSearchKeywords());
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Mind starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Sleep budget: {}ms, scheduler enabled: {}", properties.getSleep().getTimeBudgetMs(),
                properties.getScheduler().isEnabled());
    }

    static SleepComputeConfig toSleepComputeConfig(MindProperties.SleepProperties sleep) {
        return SleepComputeConfig.builder()
                .maxObservationsPerRun(sleep.getMaxObservationsPerRun())
                .minObservationsPerRun(sleep.getMinObservationsPerRun())
                .maxLearningsForBeliefs(sleep.getMaxLearningsForBeliefs())
                .beliefFormationMinConfidence(sleep.getBeliefFormationMinConfidence())
                .maxOutcomesToPropagate(sleep.getMaxOutcomesToPropagate())
                .decayStartDays(sleep.getDecayStartDays())
                .decayRate(sleep.getDecayRate())
                .decayBatchLimit(sleep.getDecayBatchLimit())
                .archivalThreshold(sleep.getArchivalThreshold())
                .archivalDays(sleep.getArchivalDays())
                .outcomeRetentionDays(sleep.getOutcomeRetentionDays())
                .conflictResolutionGap(sleep.getConflictResolutionGap())
                .timeBudget(Duration.ofMillis(sleep.getTimeBudgetMs()))
                .sessionPrepLimit(sleep.getSessionPrepLimit())
                .sessionContextItems(sleep.getSessionContextItems())
                .sessionTtl(Duration.ofHours(sleep.getSessionTtlHours()))
                .build();
    }
}
