package com.radarloop.model;

import java.util.Calendar;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * One step of the animation: the scan decoded from one archive file, or an empty slot when the
 * file could not be fetched or decoded. The session owns frames; renderers only keep references
 * for show/hide/redraw.
 */
public class Frame {

    public static final int SELECTED_VOLUME_ID_NONE = -1;
    public static final int SELECTED_SWEEP_ID_NONE = -1;

    /** Load order: 0 is the file nearest the anchor time, higher slots are older. */
    protected final int slot;
    protected final String site;
    protected final String fileName;
    protected final Calendar fileTime;
    protected volatile RadarScan scan;
    protected String failureReason;

    protected volatile int selectedVolumeId = SELECTED_VOLUME_ID_NONE;
    protected volatile int selectedSweepId = SELECTED_SWEEP_ID_NONE;
    protected volatile float selectedElevation = Float.NaN;
    protected volatile float isoLevel = Float.NaN;
    protected volatile boolean hidden = true;

    /** Outstanding sweep change started by the renderer, cleared when it completes. */
    protected final AtomicReference<CompletableFuture<Void>> pendingSweepChange =
            new AtomicReference<CompletableFuture<Void>>();

    public Frame(int slot, String site, String fileName, Calendar fileTime, RadarScan scan) {
        this.slot = slot;
        this.site = site;
        this.fileName = fileName;
        this.fileTime = fileTime;
        this.scan = scan;
    }

    public static Frame failed(int slot, String site, String fileName, Calendar fileTime, String reason) {
        Frame frame = new Frame(slot, site, fileName, fileTime, null);
        frame.failureReason = reason;
        return frame;
    }

    public boolean isLoaded() {
        return scan != null;
    }

    public int getSlot() {
        return slot;
    }

    public String getSite() {
        return site;
    }

    public String getFileName() {
        return fileName;
    }

    public Calendar getFileTime() {
        return fileTime;
    }

    public RadarScan getScan() {
        return scan;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public int getSelectedVolumeId() {
        return selectedVolumeId;
    }

    public int getSelectedSweepId() {
        return selectedSweepId;
    }

    public float getSelectedElevation() {
        return selectedElevation;
    }

    /**
     * Record the sweep this frame now displays. Called by renderers when a sweep change is requested.
     */
    public void setSelectedSweep(int volumeId, int sweepId, float elevation) {
        this.selectedVolumeId = volumeId;
        this.selectedSweepId = sweepId;
        this.selectedElevation = elevation;
    }

    public boolean isShowing(SubFrame subFrame) {
        return subFrame.getVolumeId() == selectedVolumeId && subFrame.getSweepIndex() == selectedSweepId;
    }

    public float getIsoLevel() {
        return isoLevel;
    }

    public void setIsoLevel(float isoLevel) {
        this.isoLevel = isoLevel;
    }

    public boolean isHidden() {
        return hidden;
    }

    public void setHidden(boolean hidden) {
        this.hidden = hidden;
    }

    public CompletableFuture<Void> getPendingSweepChange() {
        return pendingSweepChange.get();
    }

    public void setPendingSweepChange(final CompletableFuture<Void> change) {
        pendingSweepChange.set(change);
        change.whenComplete(new BiConsumer<Void, Throwable>() {
            @Override
            public void accept(Void ignored, Throwable error) {
                pendingSweepChange.compareAndSet(change, null);
            }
        });
    }

    /**
     * Drop the decoded data. The frame stays in place as an empty slot.
     *
     * @return the scan the frame held, for the caller to free, or null if it had none
     */
    public RadarScan detachScan() {
        RadarScan detached = scan;
        scan = null;
        return detached;
    }

    @Override
    public String toString() {
        return "Frame{slot=" + slot + ", file='" + fileName + '\'' + (isLoaded() ? "" : ", failed=" + failureReason) + '}';
    }
}
