package com.scholary.audionotes.recording;

public enum RecordingStatus {
  IDLE,
  ACTIVE
}
