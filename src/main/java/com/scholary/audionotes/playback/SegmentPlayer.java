package com.scholary.audionotes.playback;

import com.scholary.audionotes.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays one bounded clip of a recording.
 *
 * <p>The player owns at most one {@link AudioSource}. Loading a new source closes the previous one
 * and bumps a generation counter; callbacks carrying an older generation are dropped, so a slow
 * source can never move the player after it has been replaced.
 *
 * <p>Positions exposed to callers are relative to the clip start. When the clip has an explicit
 * end, playback pauses as soon as a time update reaches it and the displayed position sticks at
 * the clip length. Playing again from there restarts at the clip start.
 *
 * <p>Failures while loading put the player in {@link PlayerState#ERROR} with a message; they are
 * never thrown to the caller.
 */
public class SegmentPlayer implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentPlayer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public static final long DEFAULT_SKIP_STEP_MS = 5000;

  private final String name;
  private final long skipStepMs;

  private AudioSource source;
  private long generation;
  private PlayerState state = PlayerState.IDLE;
  private Long requestedStartMs;
  private Long requestedEndMs;
  private ClipRange clip;
  private long absolutePositionMs;
  private long displayedPositionMs;
  private boolean muted;
  private String errorMessage;

  public SegmentPlayer(String name) {
    this(name, DEFAULT_SKIP_STEP_MS);
  }

  /**
   * Create an unloaded player.
   *
   * @param name label used in log events, usually the recording id
   * @param skipStepMs distance covered by {@link #skipForward()} and {@link #skipBackward()}
   */
  public SegmentPlayer(String name, long skipStepMs) {
    if (skipStepMs <= 0) {
      throw new IllegalArgumentException("Skip step must be positive");
    }
    this.name = name;
    this.skipStepMs = skipStepMs;
  }

  /**
   * Attach a source and start loading it.
   *
   * @param newSource the source to play
   * @param startOffsetMs clip start within the file, or null for the beginning
   * @param endOffsetMs clip end within the file, or null to play to the end
   */
  public synchronized void load(AudioSource newSource, Long startOffsetMs, Long endOffsetMs) {
    detach();
    source = newSource;
    requestedStartMs = startOffsetMs;
    requestedEndMs = endOffsetMs;
    clip = null;
    absolutePositionMs = 0;
    displayedPositionMs = 0;
    errorMessage = null;
    transition(PlayerState.LOADING);

    long loadGeneration = generation;
    try {
      newSource.open(new GenerationListener(loadGeneration));
    } catch (RuntimeException e) {
      fail(loadGeneration, e);
    }
  }

  /**
   * Put the player in ERROR without a source, for when no source could be created.
   *
   * @param message reason shown to the user
   */
  public synchronized void loadFailed(String message) {
    detach();
    errorMessage = message;
    transition(PlayerState.ERROR);
    LOGGER.warn("Segment load failed: source={}, message={}", name, message);
  }

  /**
   * Start or resume playback. At or after the end bound, playback restarts from the clip start.
   *
   * @return false if nothing is loaded yet or the player is in ERROR
   */
  public synchronized boolean play() {
    if (clip == null || state == PlayerState.ERROR) {
      return false;
    }
    if (state == PlayerState.ENDED || absolutePositionMs >= clip.endMs()) {
      moveTo(clip.startMs());
    }
    source.play();
    transition(PlayerState.PLAYING);
    return true;
  }

  public synchronized void pause() {
    if (state != PlayerState.PLAYING) {
      return;
    }
    source.pause();
    transition(PlayerState.PAUSED);
  }

  public synchronized void togglePlay() {
    if (state == PlayerState.PLAYING) {
      pause();
    } else {
      play();
    }
  }

  /** @return the new muted flag */
  public synchronized boolean toggleMute() {
    muted = !muted;
    if (source != null) {
      source.setMuted(muted);
    }
    return muted;
  }

  /** Seek to a position relative to the clip start, clamped into the clip. */
  public synchronized void seek(double relativeSeconds) {
    seekRelative(Math.round(relativeSeconds * 1000));
  }

  public void skipForward() {
    skipForward(skipStepMs);
  }

  public synchronized void skipForward(long deltaMs) {
    requireNonNegative(deltaMs);
    long target = displayedPositionMs + deltaMs;
    // saturate instead of wrapping past Long.MAX_VALUE
    seekRelative(target < displayedPositionMs ? Long.MAX_VALUE : target);
  }

  public void skipBackward() {
    skipBackward(skipStepMs);
  }

  public synchronized void skipBackward(long deltaMs) {
    requireNonNegative(deltaMs);
    seekRelative(displayedPositionMs - deltaMs);
  }

  /** Milliseconds from the clip start, always within {@code [0, clipLengthMs()]}. */
  public synchronized long displayedPositionMs() {
    return displayedPositionMs;
  }

  /** Length of the loaded clip, or 0 before the source reported its duration. */
  public synchronized long clipLengthMs() {
    return clip == null ? 0 : clip.lengthMs();
  }

  public synchronized PlayerState state() {
    return state;
  }

  public synchronized boolean isMuted() {
    return muted;
  }

  /** @return the load failure message, or null */
  public synchronized String errorMessage() {
    return errorMessage;
  }

  /** {@code mm:ss / mm:ss} of the displayed position and the clip length. */
  public synchronized String timeLabel() {
    return PlaybackTimes.format(displayedPositionMs) + " / " + PlaybackTimes.format(clipLengthMs());
  }

  @Override
  public synchronized void close() {
    detach();
    clip = null;
    displayedPositionMs = 0;
    absolutePositionMs = 0;
    transition(PlayerState.IDLE);
  }

  // ---- source callbacks ----

  private synchronized void handleMetadata(long loadGeneration, long durationMs) {
    if (loadGeneration != generation || state != PlayerState.LOADING) {
      return;
    }
    clip = ClipRange.within(requestedStartMs, requestedEndMs, durationMs);
    if (muted) {
      source.setMuted(true);
    }
    if (clip.startMs() > 0) {
      source.seekTo(clip.startMs());
    }
    absolutePositionMs = clip.startMs();
    displayedPositionMs = 0;
    transition(PlayerState.READY);
  }

  private synchronized void handleTimeUpdate(long loadGeneration, long positionMs) {
    if (loadGeneration != generation || clip == null) {
      return;
    }
    absolutePositionMs = positionMs;
    if (requestedEndMs != null && positionMs >= clip.endMs()) {
      if (state == PlayerState.PLAYING) {
        source.pause();
        transition(PlayerState.ENDED);
      }
      displayedPositionMs = clip.lengthMs();
      return;
    }
    displayedPositionMs = clip.clamp(positionMs) - clip.startMs();
  }

  private synchronized void handleEnded(long loadGeneration) {
    if (loadGeneration != generation || clip == null) {
      return;
    }
    absolutePositionMs = clip.endMs();
    displayedPositionMs = clip.lengthMs();
    transition(PlayerState.ENDED);
  }

  private synchronized void fail(long loadGeneration, Throwable error) {
    if (loadGeneration != generation) {
      return;
    }
    errorMessage =
        error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    transition(PlayerState.ERROR);
    LOGGER.warn("Segment playback failed: source={}, message={}", name, errorMessage, error);
  }

  // ---- internals ----

  private void seekRelative(long relativeMs) {
    if (clip == null || state == PlayerState.ERROR) {
      return;
    }
    long bounded = Math.max(0, Math.min(relativeMs, clip.lengthMs()));
    long target = clip.clamp(clip.startMs() + bounded);
    moveTo(target);
    if (state == PlayerState.ENDED && target < clip.endMs()) {
      transition(PlayerState.PAUSED);
    }
  }

  private static void requireNonNegative(long deltaMs) {
    if (deltaMs < 0) {
      throw new IllegalArgumentException("Skip distance must not be negative: " + deltaMs);
    }
  }

  private void moveTo(long absoluteMs) {
    source.seekTo(absoluteMs);
    absolutePositionMs = absoluteMs;
    displayedPositionMs = absoluteMs - clip.startMs();
  }

  private void detach() {
    generation++;
    if (source != null) {
      AudioSource previous = source;
      source = null;
      try {
        previous.close();
      } catch (RuntimeException e) {
        LOGGER.warn("Closing audio source failed: source={}", name, e);
      }
    }
  }

  private void transition(PlayerState next) {
    if (state != next) {
      state = next;
      STRUCTURED_LOGGER.logPlayerState(name, next.name(), displayedPositionMs);
    }
  }

  /** Forwards source callbacks tagged with the generation they were registered under. */
  private final class GenerationListener implements AudioSourceListener {

    private final long loadGeneration;

    private GenerationListener(long loadGeneration) {
      this.loadGeneration = loadGeneration;
    }

    @Override
    public void onMetadata(long durationMs) {
      handleMetadata(loadGeneration, durationMs);
    }

    @Override
    public void onTimeUpdate(long positionMs) {
      handleTimeUpdate(loadGeneration, positionMs);
    }

    @Override
    public void onEnded() {
      handleEnded(loadGeneration);
    }

    @Override
    public void onError(Throwable error) {
      fail(loadGeneration, error);
    }
  }
}
