package com.scholary.audionotes.recording;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/** Clock that only moves when a test advances it, or by a fixed step on every read. */
public class MutableClock extends Clock {

  private Instant now;
  private Duration stepPerRead = Duration.ZERO;

  public MutableClock(Instant start) {
    this.now = start;
  }

  public void advance(Duration duration) {
    now = now.plus(duration);
  }

  public void set(Instant instant) {
    now = instant;
  }

  /** Move forward by {@code step} before each later {@link #instant()} call. */
  public void advanceOnEveryRead(Duration step) {
    stepPerRead = step;
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    return this;
  }

  @Override
  public Instant instant() {
    now = now.plus(stepPerRead);
    return now;
  }
}
