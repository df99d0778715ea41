package com.scholary.typesetter.api;

import java.time.Instant;

/** Error body returned by the REST API. */
public record ApiError(int status, String error, String message, String path, Instant timestamp) {}
