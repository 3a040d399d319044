package com.planforge.jobs.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planforge.common.exception.NotFoundException;
import com.planforge.config.AppProperties;
import com.planforge.jobs.model.JobEntity;
import com.planforge.jobs.model.JobStatus;
import com.planforge.jobs.model.JobType;
import com.planforge.jobs.repo.JobRepository;
import com.planforge.plans.repo.PlanRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable job queue over the {@code job_queue} table. Every state change goes through here, under a
 * row lock, so terminal rows are never rewritten and a pending row is claimed by exactly one worker.
 */
@Service
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);
    private static final List<JobStatus> ACTIVE_STATUSES = List.of(JobStatus.PENDING, JobStatus.PROCESSING);
    private static final int MAX_ERROR_CHARS = 4000;

    private final JobRepository jobRepository;
    private final PlanRepository planRepository;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    public JobStore(JobRepository jobRepository,
                    PlanRepository planRepository,
                    ObjectMapper objectMapper,
                    AppProperties appProperties) {
        this.jobRepository = jobRepository;
        this.planRepository = planRepository;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
    }

    /**
     * Inserts a pending job. A regeneration for a plan that already has one pending or processing
     * returns that job's id instead of queueing a duplicate.
     */
    @Transactional
    public UUID enqueue(JobType type, UUID planId, UUID userId, Object payload, int priority) {
        if (type == JobType.PLAN_REGENERATION && planId != null) {
            planRepository.findByIdForUpdate(planId)
                    .orElseThrow(() -> new NotFoundException("Plan not found"));
            Optional<JobEntity> active = jobRepository.findFirstByPlanIdAndTypeAndStatusInOrderByCreatedAtDesc(
                    planId, type, ACTIVE_STATUSES);
            if (active.isPresent()) {
                log.info("Regeneration for plan {} already queued as job {}", planId, active.get().getId());
                return active.get().getId();
            }
        }

        JobEntity job = new JobEntity();
        job.setType(type);
        job.setPlanId(planId);
        job.setUserId(userId);
        job.setStatus(JobStatus.PENDING);
        job.setPriority(priority);
        job.setAttempts(0);
        job.setMaxAttempts(appProperties.jobs().maxAttempts());
        job.setPayload(toJson(payload));
        JobEntity saved = jobRepository.save(job);
        log.info("Enqueued {} job {} for plan {}", type, saved.getId(), planId);
        return saved.getId();
    }

    @Transactional
    public Optional<JobEntity> claimNext(Collection<JobType> types) {
        if (types == null || types.isEmpty()) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        List<String> typeNames = types.stream().map(JobType::name).toList();
        return jobRepository.lockNextDue(typeNames, now).map(job -> {
            job.setStatus(JobStatus.PROCESSING);
            job.setStartedAt(now);
            return jobRepository.save(job);
        });
    }

    @Transactional
    public Optional<JobEntity> complete(UUID jobId, Object result) {
        return jobRepository.findByIdForUpdate(jobId).map(job -> {
            if (job.getStatus().isTerminal()) {
                log.debug("Job {} already {}; complete ignored", jobId, job.getStatus());
                return job;
            }
            job.setStatus(JobStatus.COMPLETED);
            job.setResult(result == null ? null : toJson(result));
            job.setError(null);
            job.setCompletedAt(Instant.now());
            return jobRepository.save(job);
        });
    }

    @Transactional
    public Optional<JobEntity> fail(UUID jobId, String error) {
        return fail(jobId, error, null);
    }

    /**
     * Records a failed processing attempt. Without an explicit {@code retryable} the job is retried
     * while attempts remain. A job that has used all its attempts fails permanently either way.
     */
    @Transactional
    public Optional<JobEntity> fail(UUID jobId, String error, Boolean retryable) {
        return jobRepository.findByIdForUpdate(jobId).map(job -> {
            if (job.getStatus().isTerminal()) {
                log.debug("Job {} already {}; fail ignored", jobId, job.getStatus());
                return job;
            }

            Instant now = Instant.now();
            int attempts = job.getAttempts() + 1;
            boolean reachedMax = attempts >= job.getMaxAttempts();
            boolean retry = (retryable == null ? !reachedMax : retryable) && !reachedMax;

            job.setAttempts(attempts);
            job.setPayload(appendErrorHistory(job.getPayload(), attempts, error, now));
            if (retry) {
                Instant nextRun = now.plus(retryDelay(attempts));
                job.setStatus(JobStatus.PENDING);
                job.setStartedAt(null);
                job.setCompletedAt(null);
                job.setError(null);
                job.setResult(null);
                job.setScheduledFor(nextRun);
                log.info("Job {} failed attempt {}/{}; retry at {}", jobId, attempts, job.getMaxAttempts(), nextRun);
            } else {
                job.setStatus(JobStatus.FAILED);
                job.setError(truncate(error));
                job.setCompletedAt(now);
                log.warn("Job {} failed permanently after {} attempt(s): {}", jobId, attempts, error);
            }
            return jobRepository.save(job);
        });
    }

    /**
     * Puts a claimed job that never started back to pending. Its attempt count is not touched.
     */
    @Transactional
    public Optional<JobEntity> release(UUID jobId) {
        return jobRepository.findByIdForUpdate(jobId).map(job -> {
            if (job.getStatus() != JobStatus.PROCESSING) {
                log.debug("Job {} is {}; release ignored", jobId, job.getStatus());
                return job;
            }
            job.setStatus(JobStatus.PENDING);
            job.setStartedAt(null);
            log.info("Job {} returned to the queue unprocessed", jobId);
            return jobRepository.save(job);
        });
    }

    @Transactional(readOnly = true)
    public List<JobEntity> findByPlan(UUID planId) {
        return jobRepository.findByPlanIdOrderByCreatedAtDesc(planId);
    }

    @Transactional(readOnly = true)
    public long countUserJobsSince(UUID userId, JobType type, Instant since) {
        return jobRepository.countByUserIdAndTypeAndCreatedAtGreaterThanEqual(userId, type, since);
    }

    @Transactional(readOnly = true)
    public List<JobEntity> findFailed(int limit) {
        return jobRepository.findByStatusOrderByUpdatedAtDesc(JobStatus.FAILED, PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public JobStats stats(Instant since) {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : jobRepository.countByStatusSince(since)) {
            counts.put((JobStatus) row[0], ((Number) row[1]).longValue());
        }
        long total = counts.values().stream().mapToLong(Long::longValue).sum();

        List<Object[]> windows = jobRepository.findProcessingWindowsSince(since);
        Long averageProcessingMs = windows.isEmpty()
                ? null
                : Math.round(windows.stream()
                .mapToLong(row -> Duration.between((Instant) row[0], (Instant) row[1]).toMillis())
                .average()
                .orElse(0));

        long finished = counts.get(JobStatus.COMPLETED) + counts.get(JobStatus.FAILED);
        double failureRate = finished == 0 ? 0.0 : (double) counts.get(JobStatus.FAILED) / finished;
        return new JobStats(since, counts, total, averageProcessingMs, failureRate);
    }

    Duration retryDelay(int attempts) {
        Duration max = appProperties.jobs().maxRetryDelay();
        if (attempts >= 62) {
            return max;
        }
        Duration exponential = Duration.ofSeconds(1L << attempts);
        return exponential.compareTo(max) > 0 ? max : exponential;
    }

    private String appendErrorHistory(String payload, int attempt, String error, Instant at) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (!(root instanceof ObjectNode object)) {
                return payload;
            }
            JsonNode existing = object.get("errorHistory");
            ArrayNode history = existing instanceof ArrayNode array ? array : object.putArray("errorHistory");
            history.addObject()
                    .put("attempt", attempt)
                    .put("error", truncate(error))
                    .put("timestamp", at.toString());
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException exception) {
            log.warn("Job payload is not valid JSON; error history not recorded", exception);
            return payload;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException exception) {
            throw new IllegalArgumentException("Job data is not serializable", exception);
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_CHARS) {
            return error;
        }
        return error.substring(0, MAX_ERROR_CHARS);
    }
}
