package com.phillippitts.streamscribe.service.events;

import java.time.Instant;

/**
 * Published when a finished session's recording could not be archived. Never retried.
 */
public record ArchivalFailedEvent(String sessionId, String reason, Instant at) { }
