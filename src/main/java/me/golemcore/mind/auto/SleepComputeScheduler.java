package me.golemcore.mind.auto;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mind.domain.model.SleepComputeResult;
import me.golemcore.mind.domain.model.TriggerType;
import me.golemcore.mind.domain.service.SleepComputeEngine;
import me.golemcore.mind.infrastructure.config.MindProperties;
import me.golemcore.mind.port.outbound.UserDirectoryPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background sweep that runs sleep compute for every known user.
 *
 * <p>
 * A single scheduler thread starts a sweep every
 * {@code mind.scheduler.interval-minutes}; the users of a sweep are processed
 * in parallel on a bounded worker pool. A user never has two jobs running at
 * once, and a sweep is skipped while the previous one is still in progress.
 *
 * @see SleepComputeEngine
 */
@Component
@Slf4j
public class SleepComputeScheduler {

    private final SleepComputeEngine sleepComputeEngine;
    private final UserDirectoryPort userDirectoryPort;
    private final MindProperties.SchedulerProperties settings;
    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private final Set<String> runningUsers = ConcurrentHashMap.newKeySet();
    private final ExecutorService workers;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    public SleepComputeScheduler(SleepComputeEngine sleepComputeEngine, UserDirectoryPort userDirectoryPort,
            MindProperties properties) {
        this.sleepComputeEngine = sleepComputeEngine;
        this.userDirectoryPort = userDirectoryPort;
        this.settings = properties.getScheduler();
        AtomicInteger workerIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, settings.getWorkerPoolSize()), r -> {
            Thread t = new Thread(r, "sleep-compute-worker-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("[SleepScheduler] Background sleep compute disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sleep-compute-scheduler");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleAtFixedRate(
                this::sweep,
                settings.getInitialDelayMinutes(),
                settings.getIntervalMinutes(),
                TimeUnit.MINUTES);

        log.info("[SleepScheduler] Started: every {} min, {} worker(s)", settings.getIntervalMinutes(),
                settings.getWorkerPoolSize());
    }

    @PreDestroy
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[SleepScheduler] Shut down");
    }

    /**
     * Runs sleep compute for one user on the calling thread.
     *
     * @return the job result, or empty when a job for the user is already
     *         running or the run failed
     */
    public Optional<SleepComputeResult> runForUser(String userId, TriggerType triggerType) {
        if (!runningUsers.add(userId)) {
            log.debug("[SleepScheduler] Sleep compute already running for {}, skipping", userId);
            return Optional.empty();
        }
        try {
            SleepComputeResult result = sleepComputeEngine.runSleepCompute(userId, triggerType);
            log.info("[SleepScheduler] {}: {}", userId, result.summary());
            return Optional.of(result);
        } catch (RuntimeException e) {
            log.error("[SleepScheduler] Sleep compute failed for {}: {}", userId, e.getMessage(), e);
            return Optional.empty();
        } finally {
            runningUsers.remove(userId);
        }
    }

    /**
     * Runs one scheduled job per known user and waits for all of them.
     *
     * @return number of jobs that produced a result
     */
    int sweep() {
        if (!sweeping.compareAndSet(false, true)) {
            log.debug("[SleepScheduler] Sweep skipped: previous sweep still in progress");
            return 0;
        }
        try {
            List<String> userIds = userDirectoryPort.listUserIds();
            if (userIds.isEmpty()) {
                return 0;
            }
            log.info("[SleepScheduler] Sweep over {} user(s)", userIds.size());

            List<CompletableFuture<Optional<SleepComputeResult>>> jobs = new ArrayList<>();
            for (String userId : userIds) {
                jobs.add(CompletableFuture.supplyAsync(() -> runForUser(userId, TriggerType.SCHEDULED), workers));
            }
            int completed = 0;
            for (CompletableFuture<Optional<SleepComputeResult>> job : jobs) {
                if (job.join().isPresent()) {
                    completed++;
                }
            }
            return completed;
        } catch (RuntimeException e) {
            log.error("[SleepScheduler] Sweep failed: {}", e.getMessage(), e);
            return 0;
        } finally {
            sweeping.set(false);
        }
    }
}
