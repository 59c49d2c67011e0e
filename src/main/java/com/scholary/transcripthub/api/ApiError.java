package com.scholary.transcripthub.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/** Error body returned by every endpoint. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    int status, String error, String message, String existingId, Instant timestamp) {}
