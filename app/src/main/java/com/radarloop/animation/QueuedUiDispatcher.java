package com.radarloop.animation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * UI dispatcher without a toolkit: tasks wait in a queue until the owning thread drains it. Used
 * headless and in tests, where the thread that creates the dispatcher plays the UI thread.
 */
public class QueuedUiDispatcher implements UiDispatcher {

    public static final String TAG = "QUEUEDUI";

    private static final Logger LOG = LogManager.getLogger(TAG);
    private static final long POLL_MS = 10;

    protected final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<Runnable>();
    protected final Thread uiThread;

    public QueuedUiDispatcher() {
        this(Thread.currentThread());
    }

    public QueuedUiDispatcher(Thread uiThread) {
        this.uiThread = uiThread;
    }

    @Override
    public void post(Runnable task) {
        queue.add(task);
    }

    @Override
    public boolean isUiThread() {
        return Thread.currentThread() == uiThread;
    }

    @Override
    public void await(CompletableFuture<?> done) throws InterruptedException {
        if (!isUiThread()) {
            waitOffUiThread(done);
            return;
        }
        while (!done.isDone()) {
            Runnable task = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            if (task != null) {
                runTask(task);
            }
        }
        runPending();
    }

    /**
     * Run every queued task, including ones queued by the tasks themselves.
     *
     * @return number of tasks run
     */
    public int runPending() {
        int count = 0;
        Runnable task;
        while ((task = queue.poll()) != null) {
            runTask(task);
            count++;
        }
        return count;
    }

    /**
     * Process queued tasks until {@code condition} holds or {@code timeoutMs} passes.
     *
     * @return whether the condition was met
     */
    public boolean pumpUntil(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!condition.getAsBoolean()) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return false;
            }
            Runnable task = queue.poll(Math.min(POLL_MS, remaining), TimeUnit.MILLISECONDS);
            if (task != null) {
                runTask(task);
            }
        }
        return true;
    }

    private void waitOffUiThread(CompletableFuture<?> done) throws InterruptedException {
        try {
            done.get();
        } catch (ExecutionException ex) {
            LOG.debug("awaited task failed", ex.getCause());
        }
    }

    private void runTask(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException ex) {
            LOG.error("UI task failed", ex);
        }
    }
}
