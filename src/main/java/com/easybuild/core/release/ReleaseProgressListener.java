package com.easybuild.core.release;

import java.util.concurrent.CompletableFuture;

/**
 * Receives human-readable progress messages while a release is prepared.
 *
 * <p>Supplied by whatever front end started the release (chat bot, CLI). The returned
 * future completes when the message has been delivered.
 */
@FunctionalInterface
public interface ReleaseProgressListener {

    CompletableFuture<Void> send(String message);

    static ReleaseProgressListener none() {
        return message -> CompletableFuture.completedFuture(null);
    }
}
