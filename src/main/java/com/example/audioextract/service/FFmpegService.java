package com.example.audioextract.service;

import com.example.audioextract.exception.ConversionException;
import com.example.audioextract.model.AudioMetadata;
import com.example.audioextract.model.VideoMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Service for extracting audio with FFmpeg.
 */
@Service
@Slf4j
public class FFmpegService implements TranscodingEngine {

    private static final Pattern PROGRESS_PATTERN =
            Pattern.compile("time=(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d{2})");

    private static final long PROBE_TIMEOUT_SECONDS = 30;

    private static final int MAX_STDERR_CAPTURE_BYTES = 16 * 1024;

    private final String ffmpegPath;

    private final String ffprobePath;

    private final ObjectMapper objectMapper;

    public FFmpegService(@Value("${conversion.ffmpeg.path:ffmpeg}") String ffmpegPath,
                         @Value("${conversion.ffprobe.path:ffprobe}") String ffprobePath,
                         ObjectMapper objectMapper) {
        this.ffmpegPath = ffmpegPath;
        this.ffprobePath = ffprobePath;
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts stream information from a media file using ffprobe.
     *
     * @param inputPath Path to the media file
     * @return Video metadata
     * @throws ConversionException if ffprobe fails
     */
    public VideoMetadata getVideoMetadata(Path inputPath) {
        return parseVideoMetadata(probe(inputPath));
    }

    /**
     * Checks whether a file has a video stream.
     *
     * @param inputPath Path to the media file
     * @return True if ffprobe finds a video stream
     */
    public boolean validateVideoFile(Path inputPath) {
        try {
            return getVideoMetadata(inputPath).isVideoPresent();
        } catch (ConversionException e) {
            log.debug("Validation failed for {}: {}", inputPath, e.getMessage());
            return false;
        }
    }

    @Override
    public AudioMetadata extractAudio(Path inputPath, Path outputPath, ProgressListener progressListener) {
        JsonNode probe = probe(inputPath);
        if (!parseVideoMetadata(probe).isAudioPresent()) {
            throw new ConversionException("Video file contains no audio stream");
        }
        AudioMetadata audio = parseAudioMetadata(probe);
        List<String> command = buildExtractCommand(inputPath, outputPath, audio);

        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new ConversionException("FFmpeg conversion failed: " + e.getMessage(), e);
        }

        AtomicReference<String> lastLine = new AtomicReference<>("");
        Thread outputReader = new Thread(
                () -> pumpOutput(process, audio.getDurationSeconds(), progressListener, lastLine),
                "ffmpeg-output-" + outputPath.getFileName());
        outputReader.setDaemon(true);
        outputReader.start();

        int exitCode;
        try {
            exitCode = process.waitFor();
            outputReader.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            log.info("FFmpeg process for {} stopped on interrupt", inputPath);
            throw new ConversionException("Conversion interrupted", e);
        }

        if (exitCode != 0) {
            log.error("FFmpeg failed with exit code {} for {}", exitCode, inputPath);
            throw new ConversionException("FFmpeg conversion failed: exit code " + exitCode
                    + (lastLine.get().isEmpty() ? "" : " (" + lastLine.get() + ")"));
        }

        log.info("Audio extraction completed: {}", outputPath);
        if (progressListener != null) {
            progressListener.onProgress(100);
        }
        return audio;
    }

    /**
     * Builds the FFmpeg command for a lossless PCM WAV extraction.
     *
     * @param inputPath Input file path
     * @param outputPath Output file path
     * @param audio Source audio parameters to preserve
     * @return List of command arguments
     */
    List<String> buildExtractCommand(Path inputPath, Path outputPath, AudioMetadata audio) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-i");
        command.add(inputPath.toString());
        command.add("-vn");
        command.add("-acodec");
        command.add(pcmCodecFor(audio.getBitDepth()));
        command.add("-ar");
        command.add(String.valueOf(audio.getSampleRate()));
        command.add("-ac");
        command.add(String.valueOf(audio.getChannels()));
        command.add("-f");
        command.add("wav");
        command.add("-y"); // Overwrite output files without asking
        command.add(outputPath.toString());

        log.info("FFmpeg command: {}", String.join(" ", command));
        return command;
    }

    VideoMetadata parseVideoMetadata(JsonNode probe) {
        JsonNode audioStream = findStream(probe, "audio");
        JsonNode videoStream = findStream(probe, "video");
        JsonNode format = probe.path("format");
        return VideoMetadata.builder()
                .audioPresent(audioStream != null)
                .videoPresent(videoStream != null)
                .durationSeconds((float) format.path("duration").asDouble(0))
                .format(format.path("format_name").asText("unknown"))
                .audioCodec(audioStream != null ? audioStream.path("codec_name").asText(null) : null)
                .build();
    }

    AudioMetadata parseAudioMetadata(JsonNode probe) {
        JsonNode audioStream = findStream(probe, "audio");
        if (audioStream == null) {
            throw new ConversionException("No audio stream found");
        }
        // ffprobe reports sample_rate and bit_rate as strings
        int sampleRate = audioStream.path("sample_rate").asInt(0);
        int channels = audioStream.path("channels").asInt(0);
        return AudioMetadata.builder()
                .sampleRate(sampleRate > 0 ? sampleRate : 48000)
                .channels(channels > 0 ? channels : 2)
                .bitDepth(bitDepthFor(audioStream.path("sample_fmt").asText("")))
                .durationSeconds((float) probe.path("format").path("duration").asDouble(0))
                .codec(audioStream.path("codec_name").asText("unknown"))
                .bitrate(audioStream.path("bit_rate").asLong(0))
                .build();
    }

    /**
     * Converts an ffmpeg output line into a progress percentage.
     *
     * @param line Output line
     * @param durationSeconds Total input duration
     * @return Percentage, empty if the line carries no progress
     */
    static OptionalInt parseProgress(String line, float durationSeconds) {
        if (durationSeconds <= 0) {
            return OptionalInt.empty();
        }
        Matcher matcher = PROGRESS_PATTERN.matcher(line);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        int percent = (int) ((parseTime(matcher) / durationSeconds) * 100);
        return OptionalInt.of(Math.max(0, Math.min(100, percent)));
    }

    static int bitDepthFor(String sampleFormat) {
        if (sampleFormat.contains("s32") || sampleFormat.contains("flt") || sampleFormat.contains("dbl")) {
            return 32;
        }
        if (sampleFormat.contains("s24")) {
            return 24;
        }
        return 16;
    }

    static String pcmCodecFor(int bitDepth) {
        switch (bitDepth) {
            case 24:
                return "pcm_s24le";
            case 32:
                return "pcm_s32le";
            default:
                return "pcm_s16le";
        }
    }

    private JsonNode probe(Path inputPath) {
        List<String> command = List.of(ffprobePath, "-v", "error", "-show_format", "-show_streams",
                "-of", "json", inputPath.toString());
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ConversionException("Failed to extract metadata: " + e.getMessage(), e);
        }

        // both pipes are drained concurrently so a full stderr cannot block ffprobe
        StreamCapture stdout = StreamCapture.start(process.getInputStream(), "ffprobe-stdout", Integer.MAX_VALUE);
        StreamCapture stderr = StreamCapture.start(process.getErrorStream(), "ffprobe-stderr", MAX_STDERR_CAPTURE_BYTES);
        try {
            if (!process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ConversionException("Failed to extract metadata: ffprobe timed out after "
                        + PROBE_TIMEOUT_SECONDS + " seconds");
            }
            stdout.await();
            stderr.await();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            log.info("ffprobe process for {} stopped on interrupt", inputPath);
            throw new ConversionException("Conversion interrupted", e);
        }

        if (process.exitValue() != 0) {
            String message = stderr.text().trim();
            throw new ConversionException("Failed to extract metadata: "
                    + (message.isEmpty() ? "ffprobe exit code " + process.exitValue() : message));
        }
        try {
            return objectMapper.readTree(stdout.bytes());
        } catch (IOException e) {
            throw new ConversionException("Failed to extract metadata: " + e.getMessage(), e);
        }
    }

    private void pumpOutput(Process process, float durationSeconds, ProgressListener progressListener,
                            AtomicReference<String> lastLine) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                OptionalInt percent = parseProgress(line, durationSeconds);
                if (percent.isPresent() && progressListener != null) {
                    progressListener.onProgress(percent.getAsInt());
                }
                if (!line.isBlank()) {
                    lastLine.set(line.trim());
                }
                log.debug("FFmpeg: {}", line);
            }
        } catch (IOException e) {
            // stream closes when the process is destroyed
            log.debug("FFmpeg output stream closed: {}", e.getMessage());
        }
    }

    private static JsonNode findStream(JsonNode probe, String codecType) {
        for (JsonNode stream : probe.path("streams")) {
            if (codecType.equals(stream.path("codec_type").asText())) {
                return stream;
            }
        }
        return null;
    }

    /**
     * Drains a process stream on its own daemon thread, keeping at most {@code limit} bytes.
     */
    private static final class StreamCapture {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread reader;

        private StreamCapture(InputStream stream, String name, int limit) {
            this.reader = new Thread(() -> drain(stream, limit), name);
            this.reader.setDaemon(true);
        }

        static StreamCapture start(InputStream stream, String name, int limit) {
            StreamCapture capture = new StreamCapture(stream, name, limit);
            capture.reader.start();
            return capture;
        }

        private void drain(InputStream stream, int limit) {
            byte[] chunk = new byte[8192];
            try (InputStream in = stream) {
                int read;
                while ((read = in.read(chunk)) != -1) {
                    int keep = Math.min(read, limit - buffer.size());
                    if (keep > 0) {
                        buffer.write(chunk, 0, keep);
                    }
                }
            } catch (IOException e) {
                // stream closes when the process is destroyed
                log.debug("Process stream closed: {}", e.getMessage());
            }
        }

        void await() throws InterruptedException {
            reader.join(TimeUnit.SECONDS.toMillis(5));
        }

        byte[] bytes() {
            return buffer.toByteArray();
        }

        String text() {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    /**
     * Parses time from HH:MM:SS.MS format.
     *
     * @param matcher Matcher containing time groups
     * @return Time in seconds
     */
    private static float parseTime(Matcher matcher) {
        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        int seconds = Integer.parseInt(matcher.group(3));
        int hundredths = Integer.parseInt(matcher.group(4));

        return hours * 3600 + minutes * 60 + seconds + (hundredths / 100.0f);
    }
}
