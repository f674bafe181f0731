package com.scholary.audionotes.recording;

import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Captures audio from a local input device using ffmpeg.
 *
 * <p>One ffmpeg process runs per active recording and writes an uncompressed WAV file. Stopping
 * sends {@code q} on stdin, which makes ffmpeg flush and close the file cleanly; if it does not
 * exit within the configured timeout the process is killed. The duration of the finished file is
 * read back with ffprobe rather than measured, so it reflects what actually reached the disk.
 */
@Component
public class FfmpegCaptureService implements CaptureService {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegCaptureService.class);

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss");

  private final CaptureProperties properties;
  private final Clock clock;
  private final Map<String, ActiveCapture> captures = new ConcurrentHashMap<>();

  public FfmpegCaptureService(CaptureProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public String beginCapture(String noteId, String recordingId) {
    Path directory = Path.of(properties.audioDir());
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new CaptureException("Cannot create audio directory: " + directory, e);
    }

    Path file = directory.resolve(fileName(recordingId));
    List<String> command = captureCommand(file);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      process =
          new ProcessBuilder(command)
              .redirectOutput(ProcessBuilder.Redirect.DISCARD)
              .redirectError(ProcessBuilder.Redirect.DISCARD)
              .start();
    } catch (IOException e) {
      throw new CaptureException("Failed to launch ffmpeg: " + e.getMessage(), e);
    }

    if (!process.isAlive()) {
      throw new CaptureException(
          "ffmpeg exited immediately with code " + process.exitValue() + " for " + file);
    }

    captures.put(recordingId, new ActiveCapture(process, file));
    LOGGER.info("Capture started: recordingId={}, noteId={}, file={}", recordingId, noteId, file);
    return file.toString();
  }

  @Override
  public long endCapture(String recordingId) {
    ActiveCapture capture = captures.remove(recordingId);
    if (capture == null) {
      throw new CaptureException("No capture running for recording " + recordingId);
    }

    stopProcess(capture.process(), recordingId);

    if (!Files.exists(capture.file())) {
      throw new CaptureException("Capture produced no file: " + capture.file());
    }
    long durationMs = probeDurationMs(capture.file());
    LOGGER.info(
        "Capture finalized: recordingId={}, file={}, durationMs={}",
        recordingId,
        capture.file(),
        durationMs);
    return durationMs;
  }

  /** Kill any capture still running when the application shuts down. */
  @PreDestroy
  public void shutdown() {
    captures.forEach(
        (recordingId, capture) -> {
          LOGGER.warn("Destroying capture on shutdown: recordingId={}", recordingId);
          capture.process().destroyForcibly();
        });
    captures.clear();
  }

  List<String> captureCommand(Path file) {
    // -f/-i: input device, -ac/-ar: channel count and sample rate, -y: overwrite
    return List.of(
        properties.ffmpegPath(),
        "-f",
        properties.inputFormat(),
        "-i",
        properties.inputDevice(),
        "-ac",
        String.valueOf(properties.channels()),
        "-ar",
        String.valueOf(properties.sampleRate()),
        "-y",
        file.toString());
  }

  List<String> probeCommand(Path file) {
    return List.of(
        properties.ffprobePath(),
        "-v",
        "error",
        "-show_entries",
        "format=duration",
        "-of",
        "default=noprint_wrappers=1:nokey=1",
        file.toString());
  }

  String fileName(String recordingId) {
    return LocalDateTime.now(clock).format(FILE_TIMESTAMP) + "-" + recordingId + ".wav";
  }

  /**
   * Parse ffprobe's duration output.
   *
   * @param output ffprobe stdout, a decimal number of seconds
   * @return the duration in milliseconds, rounded
   * @throws CaptureException if no duration could be read
   */
  static long parseDurationMs(String output) {
    String value =
        output == null
            ? ""
            : output.lines().map(String::strip).filter(l -> !l.isEmpty()).findFirst().orElse("");
    try {
      double seconds = Double.parseDouble(value);
      if (Double.isNaN(seconds) || seconds < 0) {
        throw new CaptureException("ffprobe reported an invalid duration: " + value);
      }
      return Math.round(seconds * 1000);
    } catch (NumberFormatException e) {
      throw new CaptureException("ffprobe reported no duration: '" + value + "'", e);
    }
  }

  private void stopProcess(Process process, String recordingId) {
    try (OutputStream stdin = process.getOutputStream()) {
      stdin.write('q');
      stdin.flush();
    } catch (IOException e) {
      // ffmpeg may already have exited; the wait below still bounds the stop
      LOGGER.warn(
          "Could not send quit to ffmpeg: recordingId={}, message={}", recordingId, e.getMessage());
    }

    try {
      if (!process.waitFor(properties.stopTimeoutSeconds(), TimeUnit.SECONDS)) {
        LOGGER.warn(
            "ffmpeg did not stop within {}s, destroying: recordingId={}",
            properties.stopTimeoutSeconds(),
            recordingId);
        process.destroyForcibly();
        process.waitFor(properties.stopTimeoutSeconds(), TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      throw new CaptureException("Interrupted while stopping capture " + recordingId, e);
    }
  }

  private long probeDurationMs(Path file) {
    List<String> command = probeCommand(file);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      process = new ProcessBuilder(command).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new CaptureException("Failed to launch ffprobe: " + e.getMessage(), e);
    }

    String output;
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      output = reader.lines().collect(Collectors.joining("\n"));
    } catch (IOException e) {
      process.destroyForcibly();
      throw new CaptureException("Failed to read ffprobe output for " + file, e);
    }

    try {
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new CaptureException(
            "ffprobe exited with code " + exitCode + " for " + file + ": " + output);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CaptureException("Interrupted while probing " + file, e);
    }

    return parseDurationMs(output);
  }

  private record ActiveCapture(Process process, Path file) {}
}
