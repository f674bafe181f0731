package com.scholary.audionotes.api;

import jakarta.validation.constraints.NotBlank;

/** Request to start recording into a note. */
public record StartRecordingRequest(@NotBlank String noteId) {}
