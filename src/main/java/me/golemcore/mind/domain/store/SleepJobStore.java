package me.golemcore.mind.domain.store;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mind.domain.model.JobStatus;
import me.golemcore.mind.domain.model.SleepJob;
import me.golemcore.mind.domain.model.SleepJobStats;
import me.golemcore.mind.domain.model.SleepTaskType;
import me.golemcore.mind.domain.model.TaskResult;
import me.golemcore.mind.domain.model.TriggerType;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Sleep job history per owner. A job is written once when it starts and once
 * when it finishes; a job left {@code RUNNING} was interrupted.
 */
@Service
public class SleepJobStore extends OwnerScopedStore {

    static final String JOBS = "sleep-jobs";

    private static final String KIND = "Sleep job";

    private static final Comparator<SleepJob> NEWEST_FIRST = Comparator.comparing(SleepJob::getStartedAt,
            Comparator.nullsLast(Comparator.reverseOrder()));

    public SleepJobStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            MindProperties properties) {
        super(storagePort, objectMapper, clock, properties.getStorage().getKnowledgeDirectory());
    }

    public SleepJob recordStart(String userId, TriggerType triggerType) {
        return withOwnerLock(userId, () -> {
            SleepJob job = SleepJob.builder()
                    .id(newId())
                    .userId(userId)
                    .triggerType(triggerType)
                    .status(JobStatus.RUNNING)
                    .totalTasks(SleepTaskType.EXECUTION_ORDER.size())
                    .startedAt(now())
                    .build();
            List<SleepJob> jobs = readJobs(userId);
            jobs.add(job);
            writeCollection(userId, JOBS, jobs);
            return job;
        });
    }

    /**
     * Records the final status and the task results of a running job.
     */
    public SleepJob recordComplete(String userId, String jobId, JobStatus status, List<TaskResult> completed,
            List<TaskResult> failed, String errorMessage) {
        return withOwnerLock(userId, () -> {
            List<SleepJob> jobs = readJobs(userId);
            SleepJob job = jobs.stream()
                    .filter(candidate -> candidate.getId().equals(jobId))
                    .findFirst()
                    .orElseThrow(() -> missingJob(jobId));
            if (job.getStatus() != JobStatus.RUNNING) {
                throw new IllegalStateException("Sleep job " + jobId + " is already " + job.getStatus());
            }
            Instant now = now();
            job.setStatus(status);
            job.setTasksCompleted(new ArrayList<>(completed));
            job.setTasksFailed(new ArrayList<>(failed));
            job.setCompletedTasks(completed.size());
            job.setFailedTasks(failed.size());
            job.setCompletedAt(now);
            job.setDurationMs(Duration.between(job.getStartedAt(), now).toMillis());
            job.setErrorMessage(errorMessage);
            writeCollection(userId, JOBS, jobs);
            return job;
        });
    }

    public SleepJob get(String userId, String jobId) {
        return readJobs(userId).stream()
                .filter(job -> job.getId().equals(jobId))
                .findFirst()
                .orElseThrow(() -> missingJob(jobId));
    }

    public List<SleepJob> list(String userId, int limit) {
        return readJobs(userId).stream().sorted(NEWEST_FIRST).limit(Math.max(limit, 0)).toList();
    }

    public SleepJobStats stats(String userId) {
        List<SleepJob> jobs = readJobs(userId);
        int completed = (int) jobs.stream().filter(job -> job.getStatus() == JobStatus.COMPLETED).count();
        int failed = (int) jobs.stream().filter(job -> job.getStatus() == JobStatus.FAILED).count();
        double avgDuration = jobs.stream()
                .map(SleepJob::getDurationMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0);
        Instant lastRun = jobs.stream()
                .map(SleepJob::getStartedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        return new SleepJobStats(jobs.size(), completed, failed, avgDuration, lastRun);
    }

    private List<SleepJob> readJobs(String userId) {
        return readCollection(userId, JOBS, SleepJob.class);
    }

    private RuntimeException missingJob(String jobId) {
        return missing(KIND, JOBS, SleepJob.class, SleepJob::getId, jobId);
    }
}
