package com.scholary.audionotes.api;

import jakarta.validation.constraints.NotNull;

public record PausedRequest(@NotNull Boolean paused) {}
