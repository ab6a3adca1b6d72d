package com.example.audioextract.service;

import com.example.audioextract.exception.ConversionException;
import com.example.audioextract.model.AudioMetadata;
import com.example.audioextract.model.VideoMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class FFmpegServiceTest {

    private static final String PROBE_WITH_AUDIO = "{"
            + "\"streams\": ["
            + "  {\"index\": 0, \"codec_type\": \"video\", \"codec_name\": \"h264\"},"
            + "  {\"index\": 1, \"codec_type\": \"audio\", \"codec_name\": \"aac\", \"sample_fmt\": \"fltp\","
            + "   \"sample_rate\": \"44100\", \"channels\": 2, \"bit_rate\": \"128000\"}"
            + "],"
            + "\"format\": {\"format_name\": \"mov,mp4,m4a,3gp,3g2,mj2\", \"duration\": \"12.500000\"}"
            + "}";

    private static final String PROBE_WITHOUT_AUDIO = "{"
            + "\"streams\": [{\"index\": 0, \"codec_type\": \"video\", \"codec_name\": \"vp9\"}],"
            + "\"format\": {\"format_name\": \"matroska,webm\", \"duration\": \"3.0\"}"
            + "}";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final FFmpegService ffmpegService = new FFmpegService("ffmpeg", "ffprobe", objectMapper);

    @TempDir
    Path temp;

    @Test
    void parsesAudioParametersFromProbeOutput() throws Exception {
        AudioMetadata audio = ffmpegService.parseAudioMetadata(objectMapper.readTree(PROBE_WITH_AUDIO));

        assertThat(audio.getSampleRate()).isEqualTo(44100);
        assertThat(audio.getChannels()).isEqualTo(2);
        assertThat(audio.getBitDepth()).isEqualTo(32);
        assertThat(audio.getCodec()).isEqualTo("aac");
        assertThat(audio.getBitrate()).isEqualTo(128000L);
        assertThat(audio.getDurationSeconds()).isEqualTo(12.5f);
    }

    @Test
    void parsesStreamLayout() throws Exception {
        VideoMetadata withAudio = ffmpegService.parseVideoMetadata(objectMapper.readTree(PROBE_WITH_AUDIO));
        VideoMetadata withoutAudio = ffmpegService.parseVideoMetadata(objectMapper.readTree(PROBE_WITHOUT_AUDIO));

        assertThat(withAudio.isAudioPresent()).isTrue();
        assertThat(withAudio.isVideoPresent()).isTrue();
        assertThat(withAudio.getAudioCodec()).isEqualTo("aac");
        assertThat(withoutAudio.isAudioPresent()).isFalse();
        assertThat(withoutAudio.getAudioCodec()).isNull();
        assertThat(withoutAudio.getFormat()).isEqualTo("matroska,webm");
    }

    @Test
    void audioMetadataRequiresAudioStream() throws Exception {
        JsonNode probe = objectMapper.readTree(PROBE_WITHOUT_AUDIO);

        assertThatThrownBy(() -> ffmpegService.parseAudioMetadata(probe))
                .isInstanceOf(ConversionException.class)
                .hasMessage("No audio stream found");
    }

    @Test
    void missingAudioFieldsFallBackToDefaults() throws Exception {
        JsonNode probe = objectMapper.readTree("{\"streams\": [{\"codec_type\": \"audio\"}], \"format\": {}}");

        AudioMetadata audio = ffmpegService.parseAudioMetadata(probe);

        assertThat(audio.getSampleRate()).isEqualTo(48000);
        assertThat(audio.getChannels()).isEqualTo(2);
        assertThat(audio.getBitDepth()).isEqualTo(16);
        assertThat(audio.getCodec()).isEqualTo("unknown");
    }

    @Test
    void buildsLosslessWavCommand() {
        AudioMetadata audio = AudioMetadata.builder().sampleRate(48000).channels(6).bitDepth(24).build();

        List<String> command = ffmpegService.buildExtractCommand(Path.of("/data/in.mkv"), Path.of("/data/in.wav"), audio);

        assertThat(command).containsExactly("ffmpeg", "-i", "/data/in.mkv", "-vn", "-acodec", "pcm_s24le",
                "-ar", "48000", "-ac", "6", "-f", "wav", "-y", "/data/in.wav");
    }

    @Test
    void mapsSampleFormatsToPcmCodecs() {
        assertThat(FFmpegService.pcmCodecFor(FFmpegService.bitDepthFor("s16p"))).isEqualTo("pcm_s16le");
        assertThat(FFmpegService.pcmCodecFor(FFmpegService.bitDepthFor("s24"))).isEqualTo("pcm_s24le");
        assertThat(FFmpegService.pcmCodecFor(FFmpegService.bitDepthFor("s32"))).isEqualTo("pcm_s32le");
        assertThat(FFmpegService.pcmCodecFor(FFmpegService.bitDepthFor("dbl"))).isEqualTo("pcm_s32le");
        assertThat(FFmpegService.pcmCodecFor(FFmpegService.bitDepthFor(""))).isEqualTo("pcm_s16le");
    }

    @Test
    void parsesProgressFromFfmpegOutput() {
        String line = "size=     512kB time=00:00:05.00 bitrate= 838.9kbits/s speed=10.1x";

        assertThat(FFmpegService.parseProgress(line, 10f)).hasValue(50);
        assertThat(FFmpegService.parseProgress("time=00:01:00.00", 10f)).hasValue(100);
        assertThat(FFmpegService.parseProgress("Stream #0:1: Audio: aac", 10f)).isEmpty();
        assertThat(FFmpegService.parseProgress(line, 0f)).isEmpty();
    }

    @Test
    void failsWhenProbeCannotRun() throws Exception {
        Path input = Files.writeString(temp.resolve("input.mp4"), "not really a video");
        FFmpegService missingBinaries = new FFmpegService(temp.resolve("no-ffmpeg").toString(),
                temp.resolve("no-ffprobe").toString(), objectMapper);

        assertThatThrownBy(() -> missingBinaries.extractAudio(input, temp.resolve("out.wav"), percent -> { }))
                .isInstanceOf(ConversionException.class)
                .hasMessageStartingWith("Failed to extract metadata");
        assertThat(missingBinaries.validateVideoFile(input)).isFalse();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void interruptStopsHungProbe() throws Exception {
        Path input = Files.writeString(temp.resolve("input.mp4"), "video");
        FFmpegService hungProbe = new FFmpegService("ffmpeg", script("hung-ffprobe", "exec sleep 20"), objectMapper);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        CompletableFuture<Void> finished = new CompletableFuture<>();

        Thread worker = new Thread(() -> {
            try {
                hungProbe.extractAudio(input, temp.resolve("out.wav"), percent -> { });
            } catch (RuntimeException e) {
                thrown.set(e);
            } finally {
                finished.complete(null);
            }
        });
        worker.start();
        Thread.sleep(300);
        long interruptedAt = System.nanoTime();
        worker.interrupt();

        finished.get(5, TimeUnit.SECONDS);
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - interruptedAt)).isLessThan(3000);
        assertThat(thrown.get())
                .isInstanceOf(ConversionException.class)
                .hasMessage("Conversion interrupted");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void probeFailureWithLargeErrorOutputDoesNotBlock() throws Exception {
        Path input = Files.writeString(temp.resolve("input.mp4"), "video");
        FFmpegService noisyProbe = new FFmpegService("ffmpeg",
                script("noisy-ffprobe", "yes 'invalid data found' | head -c 300000 >&2\necho '{}'\nexit 1"),
                objectMapper);

        assertTimeoutPreemptively(Duration.ofSeconds(10), () ->
                assertThatThrownBy(() -> noisyProbe.extractAudio(input, temp.resolve("out.wav"), percent -> { }))
                        .isInstanceOf(ConversionException.class)
                        .hasMessageStartingWith("Failed to extract metadata: invalid data found"));
    }

    private String script(String name, String body) throws Exception {
        Path script = Files.writeString(temp.resolve(name), "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script.toString();
    }
}
