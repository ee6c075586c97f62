package com.radarloop.views;

import com.radarloop.animation.UiDispatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.swing.SwingUtilities;
import java.awt.SecondaryLoop;
import java.awt.Toolkit;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.BiConsumer;

/**
 * Runs UI work on the Swing event dispatch thread. Waiting on the EDT goes through a
 * {@link SecondaryLoop}, so events keep being dispatched until the awaited work is done.
 */
public class SwingUiDispatcher implements UiDispatcher {

    public static final String TAG = "SWINGUI";

    private static final Logger LOG = LogManager.getLogger(TAG);

    @Override
    public void post(Runnable task) {
        SwingUtilities.invokeLater(task);
    }

    @Override
    public boolean isUiThread() {
        return SwingUtilities.isEventDispatchThread();
    }

    @Override
    public void await(CompletableFuture<?> done) throws InterruptedException {
        if (!isUiThread()) {
            try {
                done.get();
            } catch (ExecutionException ex) {
                LOG.debug("awaited task failed", ex.getCause());
            }
            return;
        }
        final SecondaryLoop loop = Toolkit.getDefaultToolkit().getSystemEventQueue().createSecondaryLoop();
        done.whenComplete(new BiConsumer<Object, Throwable>() {
            @Override
            public void accept(Object result, Throwable error) {
                // queued so that exit() is only seen once the loop below is pumping
                SwingUtilities.invokeLater(new Runnable() {
                    @Override
                    public void run() {
                        loop.exit();
                    }
                });
            }
        });
        if (!done.isDone()) {
            loop.enter();
        }
    }
}
