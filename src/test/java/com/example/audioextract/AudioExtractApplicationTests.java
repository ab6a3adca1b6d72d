package com.example.audioextract;

import com.example.audioextract.service.ConversionScheduler;
import com.example.audioextract.service.FileStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "storage.uploads.directory=target/test-uploads",
        "conversion.max-concurrent-jobs=2"
})
class AudioExtractApplicationTests {

    @Autowired
    private ConversionScheduler conversionScheduler;

    @Autowired
    private FileStore fileStore;

    @Test
    void contextLoadsWithStorageInitialized() {
        assertThat(Files.isDirectory(fileStore.jobDirectory("probe").getParent())).isTrue();
        assertThat(conversionScheduler.runningCount()).isZero();
        assertThat(conversionScheduler.queueLength()).isZero();
    }
}
