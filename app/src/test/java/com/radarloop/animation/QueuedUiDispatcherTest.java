package com.radarloop.animation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueuedUiDispatcherTest {

    @Test
    public void tasksRunOnlyWhenPumped() {
        QueuedUiDispatcher ui = new QueuedUiDispatcher();
        final List<String> ran = new ArrayList<String>();
        ui.post(new Runnable() {
            @Override
            public void run() {
                ran.add("first");
            }
        });
        assertTrue(ran.isEmpty());
        assertTrue(ui.isUiThread());

        assertEquals(1, ui.runPending());
        assertEquals(1, ran.size());
    }

    @Test
    public void failingTaskDoesNotStopTheQueue() {
        QueuedUiDispatcher ui = new QueuedUiDispatcher();
        final List<String> ran = new ArrayList<String>();
        ui.post(new Runnable() {
            @Override
            public void run() {
                throw new IllegalStateException("boom");
            }
        });
        ui.post(new Runnable() {
            @Override
            public void run() {
                ran.add("second");
            }
        });
        assertEquals(2, ui.runPending());
        assertEquals(1, ran.size());
    }

    @Test
    public void awaitOnUiThreadKeepsPumping() throws Exception {
        final QueuedUiDispatcher ui = new QueuedUiDispatcher();
        final CompletableFuture<Void> done = new CompletableFuture<Void>();
        // the worker can only finish once the UI thread has run its task
        Thread worker = new Thread(new Runnable() {
            @Override
            public void run() {
                final CompletableFuture<Void> handshake = new CompletableFuture<Void>();
                ui.post(new Runnable() {
                    @Override
                    public void run() {
                        handshake.complete(null);
                    }
                });
                handshake.join();
                done.complete(null);
            }
        });
        worker.start();

        ui.await(done);

        assertTrue(done.isDone());
        worker.join(5000);
    }
}
