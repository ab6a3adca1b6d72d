package com.example.audioextract.repository;

import com.example.audioextract.model.ConversionJob;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory registry of conversion jobs.
 *
 * Records are kept for the lifetime of the process so finished jobs can still be queried;
 * nothing is persisted across restarts.
 */
@Repository
public class JobRepository {

    private final Map<String, ConversionJob> jobs = new ConcurrentHashMap<>();

    /**
     * Saves a job to the repository.
     *
     * @param job Job to save
     * @return The saved job
     */
    public ConversionJob save(ConversionJob job) {
        jobs.put(job.getJobId(), job);
        return job;
    }

    /**
     * Finds a job by its ID.
     *
     * @param jobId Job ID to find
     * @return Optional containing the job if found, empty otherwise
     */
    public Optional<ConversionJob> findById(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(jobId));
    }

    /**
     * Lists all jobs, oldest first.
     *
     * @return List of all jobs
     */
    public List<ConversionJob> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(ConversionJob::getCreatedAt))
                .collect(Collectors.toList());
    }
}
