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

/**
 * Outcome of one task within a sleep job.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskResult {

    private SleepTaskType taskType;
    private JobStatus status;
    private long durationMs;
    private TaskDetails details;
    private String error;

    public static TaskResult skipped(SleepTaskType taskType, String reason) {
        return TaskResult.builder()
                .taskType(taskType)
                .status(JobStatus.SKIPPED)
                .details(new TaskDetails.Empty())
                .error(reason)
                .build();
    }
}
