package com.radarloop.app;

import com.radarloop.animation.AnimationSession;
import com.radarloop.animation.UiDispatcher;
import com.radarloop.exception.ConfigurationException;
import com.radarloop.model.PlaybackState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;

/**
 * One radar site on screen and its animation. The site may be loaded (visible) or not; the user's
 * wish to animate survives unloading, so the animation restarts when the site is loaded again.
 */
public class RadarSite {

    public static final String TAG = "RadarSite";

    private static final Logger LOG = LogManager.getLogger(TAG);

    protected final String site;
    protected final AnimationSession session;
    protected final UiDispatcher ui;

    protected volatile boolean loaded;
    protected volatile boolean animationRequested;

    public RadarSite(String site, AnimationSession session, UiDispatcher ui) {
        this.site = site;
        this.session = session;
        this.ui = ui;
    }

    /**
     * The site became visible. Starts the animation if the user asked for one.
     */
    public void load() {
        loaded = true;
        LOG.debug("load " + site + (animationRequested ? ", animation requested" : ""));
        if (animationRequested) {
            session.start();
        }
    }

    /**
     * Take the site off screen. When an animation is running it is asked to stop and the unload
     * itself waits, on the UI thread, until the worker has released its frames.
     *
     * @return completes once the site is unloaded
     */
    public CompletableFuture<Void> unload() {
        final CompletableFuture<Void> unloaded = new CompletableFuture<Void>();
        final Runnable finish = new Runnable() {
            @Override
            public void run() {
                loaded = false;
                LOG.debug("unloaded " + site);
                unloaded.complete(null);
            }
        };
        PlaybackState state = session.getState();
        if (state.isActive() || state == PlaybackState.STOPPING) {
            session.requestStop().thenRun(new Runnable() {
                @Override
                public void run() {
                    ui.post(finish);
                }
            });
        } else {
            ui.post(finish);
        }
        return unloaded;
    }

    /**
     * Play/stop toggle. Starting only happens while the site is loaded.
     *
     * @throws ConfigurationException if the animation cannot start with the current settings;
     *         the request is withdrawn
     */
    public void setAnimationRequested(boolean requested) {
        animationRequested = requested;
        if (requested) {
            if (loaded) {
                try {
                    session.start();
                } catch (ConfigurationException ex) {
                    animationRequested = false;
                    throw ex;
                }
            }
        } else {
            session.requestStop();
        }
    }

    public boolean isAnimationRequested() {
        return animationRequested;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public String getSite() {
        return site;
    }

    public AnimationSession getSession() {
        return session;
    }
}
