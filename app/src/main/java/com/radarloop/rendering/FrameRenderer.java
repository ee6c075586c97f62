package com.radarloop.rendering;

import com.radarloop.model.Frame;

import java.util.concurrent.CompletableFuture;

/**
 * Display side of the animation. The renderer only holds references to frames for display; the
 * animation session owns them and frees them after {@link #remove(Frame)}.
 * <p>
 * {@link #show}, {@link #hide}, {@link #requestRedraw} and {@link #setIso} may be called from the
 * animation worker. Everything else is UI-thread work scheduled by the renderer itself.
 */
public interface FrameRenderer {

    void show(Frame frame);

    void hide(Frame frame);

    /**
     * Ask for a repaint. Returns immediately.
     */
    void requestRedraw();

    /**
     * Recompute the frame's display for a new iso level.
     *
     * @param async false to finish the work before returning
     */
    void setIso(Frame frame, float level, boolean async);

    /**
     * Switch the sweep a frame displays. The frame's selected sweep is updated immediately; the
     * returned future completes on the UI thread once the new sweep is ready to be shown.
     */
    CompletableFuture<Void> setSweep(Frame frame, int volumeId, int sweepIndex);

    /**
     * Forget the frame. It will not be shown again.
     */
    void remove(Frame frame);
}
