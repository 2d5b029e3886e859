package me.golemcore.mind;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Mind, the cognitive consolidation
 * engine.
 *
 * <p>
 * Turns facts extracted from observed text into confidence-weighted learnings,
 * promotes strong learnings into beliefs, feeds real-world outcome feedback
 * back into their confidence and keeps the knowledge base healthy during
 * budgeted background "sleep" runs.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout:
 *
 * <pre>
 * Domain Layer       → ConfidenceModel, consolidation, formation, propagation, SleepComputeEngine
 * Knowledge Store    → per-user JSONL collections over StoragePort
 * Infrastructure     → LocalStorageAdapter, observation queue, extraction port
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code mind.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MindApplication {

    public static void main(String[] args) {
        SpringApplication.run(MindApplication.class, args);
    }

}
