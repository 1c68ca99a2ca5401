package org.taskfarm.farm.api.services;

import java.time.Instant;

/**
 * An error a service recorded while it kept running, or right before it failed.
 *
 * @param timestamp when the error occurred.
 * @param code      short category, e.g. {@code "GENERATION_FAILED"}.
 * @param message   human-readable message.
 * @param details   additional context.
 */
public record OperationalError(Instant timestamp, String code, String message, String details) {
}
