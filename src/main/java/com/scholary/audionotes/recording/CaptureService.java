package com.scholary.audionotes.recording;

/**
 * Abstraction over the device that writes audio to disk.
 *
 * <p>The session only needs two calls: start writing, and stop writing and report how long the
 * result is. Keeping it this small lets tests drive the session with a mock.
 */
public interface CaptureService {

  /**
   * Start capturing audio for a note.
   *
   * @param noteId the note being recorded into
   * @param recordingId id the session assigned to this recording
   * @return path of the file the audio is written to
   * @throws CaptureException if capture could not start
   */
  String beginCapture(String noteId, String recordingId);

  /**
   * Stop capturing and finalize the file.
   *
   * @param recordingId id passed to {@link #beginCapture}
   * @return duration of the finalized recording in milliseconds
   * @throws CaptureException if the recording could not be finalized
   */
  long endCapture(String recordingId);
}
