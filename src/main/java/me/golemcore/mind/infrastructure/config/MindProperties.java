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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties of the consolidation engine, bound from
 * application.properties under the {@code mind.*} prefix.
 *
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link SleepProperties} - sleep compute budget, batch limits, decay and
 * archival</li>
 * <li>{@link ConsolidationProperties} - extraction pre-filter</li>
 * <li>{@link FeedbackProperties} - outcome propagation weights</li>
 * <li>{@link SimilarityProperties} - keyword heuristic thresholds</li>
 * <li>{@link SchedulerProperties} - background sweep over users</li>
 * <li>{@link ExtractionProperties} - external fact extraction endpoint</li>
 * <li>{@link HttpProperties} - shared HTTP client timeouts and pool</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "mind")
@Data
public class MindProperties {

    private StorageProperties storage = new StorageProperties();
    private SleepProperties sleep = new SleepProperties();
    private ConsolidationProperties consolidation = new ConsolidationProperties();
    private FeedbackProperties feedback = new FeedbackProperties();
    private SimilarityProperties similarity = new SimilarityProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private ExtractionProperties extraction = new ExtractionProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String knowledgeDirectory = "knowledge";
        private String observationsDirectory = "observations";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/mind";
    }

    @Data
    public static class SleepProperties {
        private int maxObservationsPerRun = 200;
        private int minObservationsPerRun = 3;
        private int maxLearningsForBeliefs = 100;
        private double beliefFormationMinConfidence = 0.7;
        private int maxOutcomesToPropagate = 50;
        private int decayStartDays = 30;
        private double decayRate = 0.02;
        private int decayBatchLimit = 200;
        private double archivalThreshold = 0.15;
        private int archivalDays = 90;
        private int outcomeRetentionDays = 180;
        private double conflictResolutionGap = 0.3;
        private long timeBudgetMs = 25_000;
        private int sessionPrepLimit = 20;
        private int sessionContextItems = 10;
        private int sessionTtlHours = 24;
    }

    @Data
    public static class ConsolidationProperties {
        private int minContentLength = 50;
        private double minFactConfidence = 0.6;
        private double refinementMargin = 0.2;
    }

    @Data
    public static class FeedbackProperties {
        private double positiveChange = 0.05;
        private double negativeChange = -0.08;
        private double minChange = 0.01;
        private double maxChange = 0.15;
    }

    @Data
    public static class SimilarityProperties {
        private int minTokenLength = 3;
        private double duplicateOverlap = 0.8;
        private double contradictionOverlap = 0.4;
        private double temporalOverlap = 0.5;
        private int learningKeywordMatches = 2;
        private int beliefSearchKeywords = 5;
    }

    @Data
    public static class SchedulerProperties {
        private boolean enabled = false;
        private int intervalMinutes = 360;
        private int initialDelayMinutes = 5;
        private int workerPoolSize = 4;
    }

    @Data
    public static class ExtractionProperties {
        private boolean enabled = false;
        private String url = "http://localhost:8700";
        private String apiKey;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10_000;
        private long readTimeout = 60_000;
        private long writeTimeout = 60_000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300_000;
    }
}
