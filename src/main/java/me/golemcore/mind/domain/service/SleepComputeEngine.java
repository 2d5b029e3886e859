package me.golemcore.mind.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.mind.domain.model.Belief;
import me.golemcore.mind.domain.model.BeliefConflict;
import me.golemcore.mind.domain.model.BeliefFormationResult;
import me.golemcore.mind.domain.model.BeliefQuery;
import me.golemcore.mind.domain.model.BeliefStatus;
import me.golemcore.mind.domain.model.DecayResult;
import me.golemcore.mind.domain.model.ExtractionReport;
import me.golemcore.mind.domain.model.FormationOptions;
import me.golemcore.mind.domain.model.JobStatus;
import me.golemcore.mind.domain.model.Learning;
import me.golemcore.mind.domain.model.LearningQuery;
import me.golemcore.mind.domain.model.LearningStatus;
import me.golemcore.mind.domain.model.Observation;
import me.golemcore.mind.domain.model.OutcomeStats;
import me.golemcore.mind.domain.model.PropagationBatch;
import me.golemcore.mind.domain.model.PropagationResult;
import me.golemcore.mind.domain.model.SessionContext;
import me.golemcore.mind.domain.model.SleepComputeConfig;
import me.golemcore.mind.domain.model.SleepComputeResult;
import me.golemcore.mind.domain.model.SleepJob;
import me.golemcore.mind.domain.model.SleepTaskType;
import me.golemcore.mind.domain.model.SourceEffectiveness;
import me.golemcore.mind.domain.model.TaskDetails;
import me.golemcore.mind.domain.model.TaskResult;
import me.golemcore.mind.domain.model.TriggerType;
import me.golemcore.mind.domain.store.BeliefStore;
import me.golemcore.mind.domain.store.LearningStore;
import me.golemcore.mind.domain.store.OutcomeStore;
import me.golemcore.mind.domain.store.SessionContextStore;
import me.golemcore.mind.domain.store.SleepJobStore;
import me.golemcore.mind.port.outbound.FactExtractionException;
import me.golemcore.mind.port.outbound.FactExtractionPort;
import me.golemcore.mind.port.outbound.ObservationPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the consolidation pipeline for one user under a wall-clock budget.
 *
 * <p>
 * Tasks run strictly in {@link SleepTaskType#EXECUTION_ORDER}, one after the
 * other, because each task reads what the previous ones wrote. The budget is
 * checked before every task; once it is spent the remaining tasks are recorded
 * as skipped, except {@link SleepTaskType#SESSION_PREP} which always runs. A
 * failing task is recorded and the pipeline moves on. The job fails only when
 * every task that ran failed.
 */
@Service
@Slf4j
public class SleepComputeEngine {

    static final String BUDGET_EXCEEDED = "Time budget exceeded";
    private static final int TOP_EFFECTIVE_SOURCES = 3;

    private final FeedbackPropagationService feedbackPropagationService;
    private final LearningConsolidationService learningConsolidationService;
    private final BeliefFormationService beliefFormationService;
    private final LearningStore learningStore;
    private final BeliefStore beliefStore;
    private final OutcomeStore outcomeStore;
    private final SleepJobStore sleepJobStore;
    private final SessionContextStore sessionContextStore;
    private final ObservationPort observationPort;
    private final FactExtractionPort factExtractionPort;
    private final SleepComputeConfig config;
    private final Clock clock;

    public SleepComputeEngine(FeedbackPropagationService feedbackPropagationService,
            LearningConsolidationService learningConsolidationService,
            BeliefFormationService beliefFormationService,
            LearningStore learningStore,
            BeliefStore beliefStore,
            OutcomeStore outcomeStore,
            SleepJobStore sleepJobStore,
            SessionContextStore sessionContextStore,
            ObservationPort observationPort,
            FactExtractionPort factExtractionPort,
            SleepComputeConfig config,
            Clock clock) {
        this.feedbackPropagationService = feedbackPropagationService;
        this.learningConsolidationService = learningConsolidationService;
        this.beliefFormationService = beliefFormationService;
        this.learningStore = learningStore;
        this.beliefStore = beliefStore;
        this.outcomeStore = outcomeStore;
        this.sleepJobStore = sleepJobStore;
        this.sessionContextStore = sessionContextStore;
        this.observationPort = observationPort;
        this.factExtractionPort = factExtractionPort;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Runs one sleep job for {@code userId}. Task failures and budget
     * exhaustion are reported in the result, never thrown.
     */
    public SleepComputeResult runSleepCompute(String userId, TriggerType triggerType) {
        long startedAt = clock.millis();
        SleepJob job = sleepJobStore.recordStart(userId, triggerType);
        log.info("[SleepCompute] Starting job {} for {} ({})", job.getId(), userId, triggerType);

        List<TaskResult> tasks = new ArrayList<>();
        boolean budgetExceeded = false;
        for (SleepTaskType taskType : SleepTaskType.EXECUTION_ORDER) {
            long elapsed = clock.millis() - startedAt;
            if (!budgetExceeded && elapsed >= config.getTimeBudget().toMillis()) {
                budgetExceeded = true;
                log.warn("[SleepCompute] Time budget exceeded for job {} after {}ms (budget {}ms), skipping from {}",
                        job.getId(), elapsed, config.getTimeBudget().toMillis(), taskType.value());
            }
            if (budgetExceeded && taskType != SleepTaskType.SESSION_PREP) {
                tasks.add(TaskResult.skipped(taskType, BUDGET_EXCEEDED));
                continue;
            }
            tasks.add(executeTask(userId, job.getId(), taskType));
        }

        long totalDurationMs = clock.millis() - startedAt;
        List<TaskResult> completed = tasks.stream().filter(task -> task.getStatus() == JobStatus.COMPLETED).toList();
        List<TaskResult> failed = tasks.stream().filter(task -> task.getStatus() == JobStatus.FAILED).toList();
        JobStatus status = !failed.isEmpty() && completed.isEmpty() ? JobStatus.FAILED : JobStatus.COMPLETED;
        String errorMessage = failed.isEmpty() ? null
                : failed.stream()
                        .map(task -> task.getTaskType().value() + ": " + task.getError())
                        .collect(Collectors.joining("; "));

        try {
            sleepJobStore.recordComplete(userId, job.getId(), status, completed, failed, errorMessage);
        } catch (RuntimeException e) {
            log.error("[SleepCompute] Failed to record completion of job {}", job.getId(), e);
        }

        String summary = buildSummary(tasks, totalDurationMs);
        log.info("[SleepCompute] Job {} for {} {} in {}ms: {} completed, {} failed, {} skipped", job.getId(), userId,
                status.name().toLowerCase(Locale.ROOT), totalDurationMs, completed.size(), failed.size(),
                tasks.size() - completed.size() - failed.size());
        return new SleepComputeResult(job.getId(), userId, status, tasks, totalDurationMs, summary);
    }

    private TaskResult executeTask(String userId, String jobId, SleepTaskType taskType) {
        long started = clock.millis();
        try {
            TaskDetails details = switch (taskType) {
            case FEEDBACK_PROPAGATION -> propagateFeedback(userId);
            case LEARNING_EXTRACTION -> extractLearnings(userId);
            case BELIEF_FORMATION -> formBeliefs(userId);
            case CONFIDENCE_DECAY -> decayConfidence(userId);
            case CONFLICT_RESOLUTION -> resolveConflicts(userId);
            case ARCHIVAL -> archive(userId);
            case SESSION_PREP -> prepareSession(userId, jobId);
            };
            return TaskResult.builder()
                    .taskType(taskType)
                    .status(JobStatus.COMPLETED)
                    .durationMs(clock.millis() - started)
                    .details(details)
                    .build();
        } catch (RuntimeException e) {
            log.error("[SleepCompute] Task {} failed for {}", taskType.value(), userId, e);
            return TaskResult.builder()
                    .taskType(taskType)
                    .status(JobStatus.FAILED)
                    .durationMs(clock.millis() - started)
                    .details(new TaskDetails.Empty())
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }

    // ==================== Tasks ====================

    private TaskDetails propagateFeedback(String userId) {
        PropagationBatch batch = feedbackPropagationService.processPendingPropagations(userId,
                config.getMaxOutcomesToPropagate());
        double totalChange = 0;
        for (PropagationResult result : batch.results()) {
            totalChange += result.learningsUpdated().stream().mapToDouble(change -> Math.abs(change.change())).sum();
            totalChange += result.beliefsUpdated().stream().mapToDouble(change -> Math.abs(change.change())).sum();
        }
        int propagated = (int) batch.results().stream().filter(PropagationResult::propagated).count();
        return new TaskDetails.FeedbackPropagation(propagated, batch.learningsUpdated(), batch.beliefsUpdated(),
                totalChange);
    }

    /**
     * Extracts learnings from waiting observations. Nothing happens when fewer
     * than the configured minimum are waiting. An observation whose extraction
     * failed with a retryable error stays queued.
     */
    private TaskDetails extractLearnings(String userId) {
        List<Observation> observations = observationPort.findUnprocessed(userId, config.getMaxObservationsPerRun());
        if (observations.size() < config.getMinObservationsPerRun() || !factExtractionPort.isAvailable()) {
            return new TaskDetails.LearningExtraction(0, observations.size(), 0, 0, 0);
        }

        int processed = 0;
        int skipped = 0;
        int extracted = 0;
        int reinforced = 0;
        int contradicted = 0;
        for (Observation observation : observations) {
            try {
                ExtractionReport report = learningConsolidationService.extractAndConsolidate(userId, observation);
                observationPort.markProcessed(userId, observation.getId());
                if (report.isSkipped()) {
                    skipped++;
                    continue;
                }
                processed++;
                extracted += report.created();
                reinforced += report.reinforced();
                contradicted += report.contradicted();
            } catch (FactExtractionException e) {
                skipped++;
                log.warn("[SleepCompute] Extraction failed for observation {} (retryable: {}): {}",
                        observation.getId(), e.isRetryable(), e.getMessage());
                if (!e.isRetryable()) {
                    observationPort.markProcessed(userId, observation.getId());
                }
            } catch (RuntimeException e) {
                skipped++;
                log.warn("[SleepCompute] Failed to process observation {}: {}", observation.getId(),
                        e.getMessage());
            }
        }
        return new TaskDetails.LearningExtraction(processed, skipped, extracted, reinforced, contradicted);
    }

    private TaskDetails formBeliefs(String userId) {
        BeliefFormationResult result = beliefFormationService.formBeliefsFromLearnings(userId,
                FormationOptions.builder()
                        .minConfidence(config.getBeliefFormationMinConfidence())
                        .maxLearnings(config.getMaxLearningsForBeliefs())
                        .build());
        return new TaskDetails.BeliefFormation(result.evaluated(), result.formed().size(), result.skipped().size(),
                result.conflicts().size());
    }

    private TaskDetails decayConfidence(String userId) {
        Instant staleBefore = clock.instant().minus(Duration.ofDays(config.getDecayStartDays()));
        DecayResult learnings = learningStore.applyDecay(userId, staleBefore, config.getDecayRate(),
                config.getArchivalThreshold(), config.getDecayBatchLimit());
        DecayResult beliefs = beliefStore.applyDecay(userId, staleBefore, config.getDecayRate(),
                config.getArchivalThreshold(), config.getDecayBatchLimit());
        return new TaskDetails.ConfidenceDecay(learnings.decayed(), beliefs.decayed(), learnings.weakened(),
                beliefs.weakened());
    }

    /**
     * Resolves conflicts whose confidence gap is wide enough; the rest are
     * escalated. Conflicts still waiting for their second belief are left
     * alone.
     */
    private TaskDetails resolveConflicts(String userId) {
        int evaluated = 0;
        int autoResolved = 0;
        int escalated = 0;
        for (BeliefConflict conflict : beliefStore.listUnresolvedConflicts(userId)) {
            if (conflict.isPending()) {
                continue;
            }
            evaluated++;
            Optional<Belief> first = beliefStore.find(userId, conflict.getBeliefAId());
            Optional<Belief> second = beliefStore.find(userId, conflict.getBeliefBId());
            if (first.isEmpty() || second.isEmpty()) {
                beliefStore.resolveConflict(userId, conflict.getId(), "One belief no longer exists", null);
                autoResolved++;
                continue;
            }

            Belief a = first.get();
            Belief b = second.get();
            double gap = Math.abs(a.getCurrentConfidence() - b.getCurrentConfidence());
            if (gap >= config.getConflictResolutionGap()) {
                Belief winner = a.getCurrentConfidence() > b.getCurrentConfidence() ? a : b;
                Belief loser = winner == a ? b : a;
                String resolution = String.format(Locale.ROOT, "Auto-resolved: \"%s\" (%.0f%%) vs \"%s\" (%.0f%%)",
                        winner.getProposition(), winner.getCurrentConfidence() * 100, loser.getProposition(),
                        loser.getCurrentConfidence() * 100);
                beliefStore.resolveConflict(userId, conflict.getId(), resolution, winner.getId(),
                        BeliefStatus.UNCERTAIN);
                autoResolved++;
            } else {
                beliefStore.escalateConflict(userId, conflict.getId());
                escalated++;
            }
        }
        return new TaskDetails.ConflictResolution(evaluated, autoResolved, escalated);
    }

    private TaskDetails archive(String userId) {
        Instant now = clock.instant();
        Instant staleBefore = now.minus(Duration.ofDays(config.getArchivalDays()));
        int learnings = learningStore.archiveStale(userId, config.getArchivalThreshold(), staleBefore);
        int beliefs = beliefStore.archiveStale(userId, config.getArchivalThreshold(), staleBefore);
        int outcomes = outcomeStore.deletePropagatedBefore(userId,
                now.minus(Duration.ofDays(config.getOutcomeRetentionDays())));
        return new TaskDetails.Archival(learnings, beliefs, outcomes);
    }

    private TaskDetails prepareSession(String userId, String jobId) {
        List<Belief> beliefs = beliefStore.query(BeliefQuery.builder()
                .userId(userId)
                .statuses(Set.of(BeliefStatus.ACTIVE))
                .orderBy(BeliefQuery.OrderBy.CONFIDENCE)
                .descending(true)
                .limit(config.getSessionPrepLimit())
                .build()).items();
        List<Learning> learnings = learningStore.list(userId, LearningQuery.builder()
                .status(LearningStatus.ACTIVE)
                .limit(config.getSessionPrepLimit())
                .build()).items();
        OutcomeStats stats = outcomeStore.stats(userId);
        List<String> effectiveSources = outcomeStore.sourceEffectiveness(userId).stream()
                .filter(effectiveness -> effectiveness.positiveOutcomes() > 0)
                .limit(TOP_EFFECTIVE_SOURCES)
                .map(SleepComputeEngine::describeSource)
                .toList();
        int items = config.getSessionContextItems();

        Instant now = clock.instant();
        SessionContext context = SessionContext.builder()
                .userId(userId)
                .jobId(jobId)
                .generatedAt(now)
                .expiresAt(now.plus(config.getSessionTtl()))
                .topBeliefs(beliefs.stream()
                        .limit(items)
                        .map(belief -> new SessionContext.BeliefSummary(belief.getId(), belief.getProposition(),
                                belief.getCurrentConfidence(), belief.getDomain()))
                        .collect(Collectors.toCollection(ArrayList::new)))
                .topLearnings(learnings.stream()
                        .limit(items)
                        .map(learning -> new SessionContext.LearningSummary(learning.getId(), learning.getStatement(),
                                learning.getConfidence(), learning.getCategory()))
                        .collect(Collectors.toCollection(ArrayList::new)))
                .recentOutcomes(new SessionContext.OutcomeSummary(stats.total(), stats.positiveRate(),
                        effectiveSources))
                .pendingItems(new SessionContext.PendingItems(
                        beliefStore.listUnresolvedConflicts(userId).size(),
                        beliefStore.count(userId, BeliefStatus.UNCERTAIN),
                        learningStore.count(userId, LearningStatus.WEAKENED)))
                .build();
        sessionContextStore.replace(context);
        return new TaskDetails.SessionPrep(beliefs.size(), learnings.size(), stats.total(), true);
    }

    private static String describeSource(SourceEffectiveness effectiveness) {
        return String.format(Locale.ROOT, "%s (%.0f%%)", effectiveness.sourceType().name().toLowerCase(Locale.ROOT),
                effectiveness.effectivenessRate() * 100);
    }

    // ==================== Summary ====================

    static String buildSummary(List<TaskResult> tasks, long durationMs) {
        List<String> parts = new ArrayList<>();
        parts.add("Sleep compute completed in " + durationMs + "ms.");
        for (TaskResult task : tasks) {
            if (task.getStatus() == JobStatus.FAILED) {
                parts.add("[FAIL] " + task.getTaskType().value() + ": " + task.getError());
                continue;
            }
            if (task.getStatus() != JobStatus.COMPLETED || task.getDetails() == null
                    || task.getDetails().isTrivial()) {
                continue;
            }
            describe(task.getDetails()).ifPresent(parts::add);
        }
        return String.join(" ", parts);
    }

    private static Optional<String> describe(TaskDetails details) {
        if (details instanceof TaskDetails.FeedbackPropagation d) {
            return Optional.of("Propagated " + d.outcomesPropagated() + " feedback items");
        }
        if (details instanceof TaskDetails.LearningExtraction d && d.learningsExtracted() > 0) {
            return Optional.of("Extracted " + d.learningsExtracted() + " learnings from "
                    + d.observationsProcessed() + " observations");
        }
        if (details instanceof TaskDetails.BeliefFormation d) {
            return Optional.of("Formed " + d.beliefsFormed() + " new beliefs");
        }
        if (details instanceof TaskDetails.ConfidenceDecay d) {
            return Optional.of("Decayed " + d.learningsDecayed() + " learnings, " + d.beliefsDecayed() + " beliefs");
        }
        if (details instanceof TaskDetails.ConflictResolution d) {
            return Optional.of("Auto-resolved " + d.conflictsAutoResolved() + " conflicts");
        }
        if (details instanceof TaskDetails.Archival d) {
            return Optional.of("Archived " + d.learningsArchived() + " learnings, " + d.beliefsArchived()
                    + " beliefs, " + d.outcomesArchived() + " outcomes");
        }
        if (details instanceof TaskDetails.SessionPrep d) {
            return Optional.of("Session context prepared (" + d.topBeliefs() + " beliefs, " + d.topLearnings()
                    + " learnings)");
        }
        return Optional.empty();
    }
}
