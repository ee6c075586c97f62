package com.radarloop.animation;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Timed sleep for the animation worker that other threads can cut short. A poke that arrives
 * while the worker is busy is remembered and ends the next sleep at once, so no command is lost
 * between two sleeps.
 */
public class WorkerSleeper {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition poked = lock.newCondition();
    private boolean pokePending;

    /**
     * Block for up to {@code durationMs}.
     *
     * @return true if a poke (or a thread interrupt) ended the sleep early, false if the time ran out
     */
    public boolean sleep(long durationMs) {
        long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0, durationMs));
        lock.lock();
        try {
            while (!pokePending) {
                if (remaining <= 0) {
                    return false;
                }
                try {
                    remaining = poked.awaitNanos(remaining);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return true;
                }
            }
            pokePending = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wake the sleeping worker, or make its next sleep return immediately.
     */
    public void poke() {
        lock.lock();
        try {
            pokePending = true;
            poked.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forget a poke nobody has consumed yet.
     */
    public void clear() {
        lock.lock();
        try {
            pokePending = false;
        } finally {
            lock.unlock();
        }
    }
}
