package com.gentoro.mcprouter.exception;

import java.time.Instant;
import java.util.Map;

/** Serializable description of a failure, used in API responses and logs. */
public record ErrorDetails(
    String type,
    String message,
    RouterErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
