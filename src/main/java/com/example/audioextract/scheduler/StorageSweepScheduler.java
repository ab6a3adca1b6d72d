package com.example.audioextract.scheduler;

import com.example.audioextract.service.FileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Periodically removes job directories that outlived the retention period, whatever state
 * their job is in. Catches files left behind by jobs whose cleanup never ran.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorageSweepScheduler {

    private final FileStore fileStore;

    @Value("${storage.retention-ms:3600000}")
    private long retentionMs;

    @Scheduled(fixedDelayString = "${storage.sweep.interval-ms:900000}",
            initialDelayString = "${storage.sweep.interval-ms:900000}")
    public void sweepExpiredJobDirectories() {
        log.debug("Running storage sweep for directories older than {} ms", retentionMs);
        try {
            int removed = fileStore.sweepOlderThan(retentionMs);
            log.info("Finished storage sweep. Removed {} job directories.", removed);
        } catch (IOException e) {
            log.error("Storage sweep failed: {}", e.getMessage(), e);
        }
    }
}
