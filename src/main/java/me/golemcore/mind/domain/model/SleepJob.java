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
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted record of one sleep compute run for one user.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SleepJob {

    private String id;
    private String userId;
    private TriggerType triggerType;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Builder.Default
    private List<TaskResult> tasksCompleted = new ArrayList<>();

    @Builder.Default
    private List<TaskResult> tasksFailed = new ArrayList<>();

    private int totalTasks;
    private int completedTasks;
    private int failedTasks;

    private Instant startedAt;
    private Instant completedAt;
    private Long durationMs;
    private String errorMessage;
}
