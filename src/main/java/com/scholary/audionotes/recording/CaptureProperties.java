package com.scholary.audionotes.recording;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg-based audio capture.
 *
 * <p>{@code inputFormat} and {@code inputDevice} are passed straight to {@code ffmpeg -f ... -i
 * ...}, so they depend on the host: {@code pulse}/{@code default} on Linux, {@code
 * avfoundation}/{@code :0} on macOS.
 */
@ConfigurationProperties(prefix = "capture")
@Validated
public record CaptureProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @NotBlank String inputFormat,
    @NotBlank String inputDevice,
    @NotBlank String audioDir,
    @Positive int sampleRate,
    @Positive int channels,
    @Positive int stopTimeoutSeconds) {}
