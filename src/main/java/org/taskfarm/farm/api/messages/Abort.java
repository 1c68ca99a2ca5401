package org.taskfarm.farm.api.messages;

import java.util.Objects;

/**
 * Abort signal broadcast by the dispatcher after a fatal failure.
 * <p>
 * A worker receiving it stops at once: it sends nothing more and does not wait on the
 * rendezvous, which the aborting side has already broken.
 *
 * @param reason human-readable cause, for logging.
 */
public record Abort(String reason) implements WorkerMessage {

    public Abort {
        Objects.requireNonNull(reason, "reason");
    }
}
