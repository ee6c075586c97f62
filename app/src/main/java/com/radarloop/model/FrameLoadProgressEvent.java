package com.radarloop.model;

/**
 * Emitted while a frame window is being built, once per transfer update and once per outcome.
 */
public class FrameLoadProgressEvent {

    public enum Status {FETCHING, LOADED, FAILED};

    protected final String site;
    protected final int slot;
    protected final int slotCount;
    protected final String fileName;
    protected final Status status;
    protected final long bytesRead;
    protected final long bytesTotal;

    public FrameLoadProgressEvent(String site, int slot, int slotCount, String fileName, Status status,
                                  long bytesRead, long bytesTotal) {
        this.site = site;
        this.slot = slot;
        this.slotCount = slotCount;
        this.fileName = fileName;
        this.status = status;
        this.bytesRead = bytesRead;
        this.bytesTotal = bytesTotal;
    }

    public String getSite() {
        return site;
    }

    public int getSlot() {
        return slot;
    }

    public int getSlotCount() {
        return slotCount;
    }

    public String getFileName() {
        return fileName;
    }

    public Status getStatus() {
        return status;
    }

    public long getBytesRead() {
        return bytesRead;
    }

    public long getBytesTotal() {
        return bytesTotal;
    }

    /**
     * @return overall window progress in [0, 1], counting the current file's transfer fraction
     */
    public double getFraction() {
        if (slotCount <= 0) {
            return 0.0;
        }
        double fileFraction = 0.0;
        if (status != Status.FETCHING) {
            fileFraction = 1.0;
        } else if (bytesTotal > 0) {
            fileFraction = Math.min(1.0, (double) bytesRead / bytesTotal);
        }
        return Math.min(1.0, (slot + fileFraction) / slotCount);
    }

    @Override
    public String toString() {
        return "FrameLoadProgressEvent{" + site + " " + (slot + 1) + "/" + slotCount + " " + fileName + " " + status + '}';
    }
}
