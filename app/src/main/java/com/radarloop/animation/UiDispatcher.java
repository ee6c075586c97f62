package com.radarloop.animation;

import java.util.concurrent.CompletableFuture;

/**
 * Marshals work onto the single UI thread.
 */
public interface UiDispatcher {

    /**
     * Queue {@code task} to run on the UI thread. Never runs it inline.
     */
    void post(Runnable task);

    boolean isUiThread();

    /**
     * Block until {@code done} completes. When called on the UI thread the UI keeps processing
     * queued work while waiting, so tasks the awaited work depends on still run.
     */
    void await(CompletableFuture<?> done) throws InterruptedException;
}
