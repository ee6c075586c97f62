package com.radarloop.exception;

/**
 * A single archive file could not be transferred to local storage.
 */
public class FetchFailureException extends RadarLoopException {

    protected final String fileName;

    public FetchFailureException(String fileName, String detailMessage) {
        super(detailMessage);
        this.fileName = fileName;
    }

    public FetchFailureException(String fileName, String detailMessage, Throwable cause) {
        super(detailMessage, cause);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
