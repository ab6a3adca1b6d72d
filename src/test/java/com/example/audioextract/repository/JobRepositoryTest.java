package com.example.audioextract.repository;

import com.example.audioextract.model.ConversionJob;
import com.example.audioextract.model.JobStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JobRepositoryTest {

    private final JobRepository repository = new JobRepository();

    @Test
    void findsSavedJobsById() {
        ConversionJob job = repository.save(ConversionJob.createNew(Path.of("in.mp4"), Path.of("in.wav"), "in.mp4"));

        assertThat(repository.findById(job.getJobId())).containsSame(job);
        assertThat(repository.findById("missing")).isEmpty();
        assertThat(repository.findById(null)).isEmpty();
    }

    @Test
    void listsAllJobsOldestFirstIncludingFinishedOnes() {
        ConversionJob first = repository.save(ConversionJob.createNew(Path.of("a.mp4"), Path.of("a.wav"), "a.mp4"));
        ConversionJob second = repository.save(ConversionJob.builder()
                .jobId("later").inputPath(Path.of("b.mp4")).outputPath(Path.of("b.wav")).originalFilename("b.mp4")
                .createdAt(first.getCreatedAt().plusSeconds(1)).status(JobStatus.QUEUED).build());
        first.markProcessing();
        first.markCancelled();

        assertThat(repository.findAll()).containsExactly(first, second);
    }
}
