package com.example.audioextract.service;

import com.example.audioextract.model.AudioMetadata;
import com.example.audioextract.model.ConversionJob;
import com.example.audioextract.model.JobStatus;
import com.example.audioextract.model.JobView;
import com.example.audioextract.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Queues conversion jobs and runs a bounded number of them at a time.
 *
 * <p>Jobs are admitted in submission order. Queue, running set and job state are guarded by a
 * single lock which is never held while the engine runs. A job terminates exactly once: the
 * first of engine success, engine failure, cancellation or watchdog timeout to take the lock
 * decides the final status, and later triggers are no-ops.
 */
@Service
@Slf4j
public class ConversionScheduler {

    static final String TIMEOUT_ERROR = "Conversion timeout exceeded";
    static final String UNKNOWN_ERROR = "Unknown error occurred";

    private final JobRepository jobRepository;

    private final TranscodingEngine transcodingEngine;

    private final FileStore fileStore;

    private final AsyncTaskExecutor conversionExecutor;

    private final TaskScheduler watchdogScheduler;

    private final int maxConcurrentJobs;

    private final long timeoutMs;

    private final long retentionMs;

    private final Object lock = new Object();

    private final Deque<String> queue = new ArrayDeque<>();

    private final Map<String, RunningJob> running = new HashMap<>();

    public ConversionScheduler(JobRepository jobRepository,
                               TranscodingEngine transcodingEngine,
                               FileStore fileStore,
                               @Qualifier("conversionExecutor") AsyncTaskExecutor conversionExecutor,
                               @Qualifier("watchdogScheduler") TaskScheduler watchdogScheduler,
                               @Value("${conversion.max-concurrent-jobs:3}") int maxConcurrentJobs,
                               @Value("${conversion.timeout-ms:1800000}") long timeoutMs,
                               @Value("${storage.retention-ms:3600000}") long retentionMs) {
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("conversion.max-concurrent-jobs must be at least 1");
        }
        this.jobRepository = jobRepository;
        this.transcodingEngine = transcodingEngine;
        this.fileStore = fileStore;
        this.conversionExecutor = conversionExecutor;
        this.watchdogScheduler = watchdogScheduler;
        this.maxConcurrentJobs = maxConcurrentJobs;
        this.timeoutMs = timeoutMs;
        this.retentionMs = retentionMs;
        log.info("Initialized conversion scheduler: maxConcurrentJobs={}, timeoutMs={}", maxConcurrentJobs, timeoutMs);
    }

    /**
     * Queues a new conversion job and starts it if a slot is free. Never waits for the engine.
     *
     * @param inputPath Path to the uploaded input file
     * @param outputPath Path the WAV output is written to
     * @param originalFilename File name supplied by the uploader
     * @return ID of the new job
     */
    public String submit(Path inputPath, Path outputPath, String originalFilename) {
        return enqueue(ConversionJob.createNew(inputPath, outputPath, originalFilename));
    }

    /**
     * Queues a new conversion job under an ID the caller already stored files for, so the
     * job's directory in the {@link FileStore} is removed along with the job.
     *
     * @param jobId ID to register the job under
     * @param inputPath Path to the uploaded input file
     * @param outputPath Path the WAV output is written to
     * @param originalFilename File name supplied by the uploader
     * @return ID of the new job
     * @throws IllegalArgumentException if a job with this ID already exists
     */
    public String submit(String jobId, Path inputPath, Path outputPath, String originalFilename) {
        return enqueue(ConversionJob.createNew(jobId, inputPath, outputPath, originalFilename));
    }

    private String enqueue(ConversionJob job) {
        synchronized (lock) {
            if (jobRepository.findById(job.getJobId()).isPresent()) {
                throw new IllegalArgumentException("Job already exists: " + job.getJobId());
            }
            jobRepository.save(job);
            queue.addLast(job.getJobId());
        }
        log.info("Queued conversion job {} for {}", job.getJobId(), job.getOriginalFilename());
        admitQueuedJobs();
        return job.getJobId();
    }

    /**
     * Gets a snapshot of a job.
     *
     * @param jobId ID of the job
     * @return The job view, empty if no such job exists
     */
    public Optional<JobView> status(String jobId) {
        synchronized (lock) {
            return jobRepository.findById(jobId).map(JobView::of);
        }
    }

    /**
     * Cancels a queued or processing job.
     *
     * @param jobId ID of the job to cancel
     * @return True if the job was cancelled, false if it is unknown or already finished
     */
    public boolean cancel(String jobId) {
        RunningJob runningJob;
        synchronized (lock) {
            Optional<ConversionJob> jobOpt = jobRepository.findById(jobId);
            if (jobOpt.isEmpty()) {
                return false;
            }
            ConversionJob job = jobOpt.get();
            if (job.getStatus() == JobStatus.QUEUED) {
                queue.remove(jobId);
                job.markCancelled();
                runningJob = null;
            } else if (job.getStatus() == JobStatus.PROCESSING) {
                runningJob = running.get(jobId);
                if (runningJob == null || !terminateLocked(runningJob, Outcome.cancelled())) {
                    return false;
                }
            } else {
                return false;
            }
        }

        log.info("Cancelled job {}", jobId);
        if (runningJob != null) {
            afterTermination(runningJob, true);
        } else {
            cleanupQuietly(jobId);
        }
        return true;
    }

    /**
     * Lists all jobs ever submitted, oldest first.
     *
     * @return Snapshots of all jobs
     */
    public List<JobView> jobs() {
        synchronized (lock) {
            return jobRepository.findAll().stream().map(JobView::of).collect(Collectors.toList());
        }
    }

    /**
     * @return Number of jobs currently occupying a slot
     */
    public int runningCount() {
        synchronized (lock) {
            return running.size();
        }
    }

    /**
     * @return Number of jobs waiting for a slot
     */
    public int queueLength() {
        synchronized (lock) {
            return queue.size();
        }
    }

    /**
     * Moves queued jobs into free slots, oldest first. Jobs the executor refuses are failed
     * on the spot and their slots are offered to the rest of the queue.
     */
    private void admitQueuedJobs() {
        boolean slotFreed = true;
        while (slotFreed) {
            List<RunningJob> admitted = new ArrayList<>();
            synchronized (lock) {
                while (running.size() < maxConcurrentJobs && !queue.isEmpty()) {
                    String jobId = queue.pollFirst();
                    Optional<ConversionJob> jobOpt = jobRepository.findById(jobId);
                    if (jobOpt.isEmpty() || jobOpt.get().getStatus() != JobStatus.QUEUED) {
                        log.warn("Skipping queued job {} with no pending record", jobId);
                        continue;
                    }
                    ConversionJob job = jobOpt.get();
                    job.markProcessing();
                    RunningJob runningJob = new RunningJob(job);
                    running.put(jobId, runningJob);
                    admitted.add(runningJob);
                }
            }
            slotFreed = false;
            for (RunningJob runningJob : admitted) {
                if (!start(runningJob)) {
                    slotFreed = true;
                }
            }
        }
    }

    /**
     * Hands an admitted job to the executor.
     *
     * @return False if the executor rejected the job and it was failed instead
     */
    private boolean start(RunningJob runningJob) {
        String jobId = runningJob.job.getJobId();
        log.info("Starting conversion job {}", jobId);

        ScheduledFuture<?> watchdog = watchdogScheduler.schedule(() -> onTimeout(runningJob),
                Instant.now().plusMillis(timeoutMs));
        Future<?> execution;
        try {
            execution = conversionExecutor.submit(() -> execute(runningJob));
        } catch (TaskRejectedException e) {
            watchdog.cancel(false);
            log.error("Could not start conversion job {}: {}", jobId, e.getMessage());
            boolean won;
            synchronized (lock) {
                won = terminateLocked(runningJob, Outcome.failed("Conversion could not be started: " + e.getMessage()));
            }
            if (won) {
                release(runningJob, false);
            }
            return false;
        }

        boolean alreadyTerminated;
        synchronized (lock) {
            runningJob.watchdog = watchdog;
            runningJob.execution = execution;
            alreadyTerminated = runningJob.terminated;
        }
        if (alreadyTerminated) {
            // terminated before the handles were recorded
            watchdog.cancel(false);
            execution.cancel(true);
        }
        return true;
    }

    private void execute(RunningJob runningJob) {
        ConversionJob job = runningJob.job;
        Outcome outcome;
        try {
            AudioMetadata metadata = transcodingEngine.extractAudio(job.getInputPath(), job.getOutputPath(),
                    percent -> onProgress(runningJob, percent));
            outcome = Outcome.completed(metadata);
        } catch (RuntimeException e) {
            outcome = Outcome.failed(e.getMessage());
        } catch (Error e) {
            log.error("Engine error in conversion job {}", job.getJobId(), e);
            outcome = Outcome.failed(e.getMessage());
        }

        boolean won;
        synchronized (lock) {
            won = terminateLocked(runningJob, outcome);
        }
        if (!won) {
            log.debug("Ignoring late engine result for job {} ({})", job.getJobId(), job.getStatus());
            return;
        }
        if (outcome.status == JobStatus.COMPLETED) {
            log.info("Completed conversion job {}", job.getJobId());
        } else {
            log.error("Conversion job {} failed: {}", job.getJobId(), outcome.error);
        }
        afterTermination(runningJob, false);
    }

    private void onProgress(RunningJob runningJob, int percent) {
        synchronized (lock) {
            if (runningJob.terminated) {
                return;
            }
            if (runningJob.job.advanceProgress(percent)) {
                log.debug("Job {} progress {}%", runningJob.job.getJobId(), runningJob.job.getProgress());
            }
        }
    }

    private void onTimeout(RunningJob runningJob) {
        boolean won;
        synchronized (lock) {
            won = terminateLocked(runningJob, Outcome.failed(TIMEOUT_ERROR));
        }
        if (won) {
            log.warn("Conversion job {} timed out after {} ms", runningJob.job.getJobId(), timeoutMs);
            afterTermination(runningJob, true);
        }
    }

    /**
     * Applies the terminal transition if the job has not terminated yet and frees its slot.
     * Must be called with the lock held.
     *
     * @return True if this call terminated the job
     */
    private boolean terminateLocked(RunningJob runningJob, Outcome outcome) {
        ConversionJob job = runningJob.job;
        if (runningJob.terminated || job.getStatus().isTerminal()) {
            return false;
        }
        runningJob.terminated = true;
        switch (outcome.status) {
            case COMPLETED:
                job.markCompleted(outcome.metadata);
                break;
            case CANCELLED:
                job.markCancelled();
                break;
            default:
                job.markFailed(outcome.error);
        }
        running.remove(job.getJobId(), runningJob);
        return true;
    }

    /**
     * Runs once per job, by whichever trigger terminated it.
     */
    private void afterTermination(RunningJob runningJob, boolean stopEngine) {
        release(runningJob, stopEngine);
        admitQueuedJobs();
    }

    /**
     * Disarms the watchdog, optionally stops the engine, and disposes of the job's files.
     */
    private void release(RunningJob runningJob, boolean stopEngine) {
        ScheduledFuture<?> watchdog;
        Future<?> execution;
        synchronized (lock) {
            watchdog = runningJob.watchdog;
            execution = runningJob.execution;
        }
        if (watchdog != null) {
            watchdog.cancel(false);
        }
        if (stopEngine && execution != null) {
            execution.cancel(true);
        }

        String jobId = runningJob.job.getJobId();
        if (runningJob.job.getStatus() == JobStatus.COMPLETED) {
            fileStore.scheduleDelayedCleanup(jobId, retentionMs);
        } else {
            cleanupQuietly(jobId);
        }
    }

    private void cleanupQuietly(String jobId) {
        try {
            fileStore.cleanup(jobId);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to clean up files for job {}: {}", jobId, e.getMessage(), e);
        }
    }

    /**
     * A job occupying a slot, with the handles needed to stop it.
     */
    private static final class RunningJob {
        private final ConversionJob job;
        private ScheduledFuture<?> watchdog;
        private Future<?> execution;
        private boolean terminated;

        private RunningJob(ConversionJob job) {
            this.job = job;
        }
    }

    /**
     * Terminal result of a job.
     */
    private static final class Outcome {
        private final JobStatus status;
        private final AudioMetadata metadata;
        private final String error;

        private Outcome(JobStatus status, AudioMetadata metadata, String error) {
            this.status = status;
            this.metadata = metadata;
            this.error = error;
        }

        static Outcome completed(AudioMetadata metadata) {
            return new Outcome(JobStatus.COMPLETED, metadata, null);
        }

        static Outcome failed(String error) {
            return new Outcome(JobStatus.FAILED, null, error == null || error.isBlank() ? UNKNOWN_ERROR : error);
        }

        static Outcome cancelled() {
            return new Outcome(JobStatus.CANCELLED, null, null);
        }
    }
}
