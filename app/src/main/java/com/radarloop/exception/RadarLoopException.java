package com.radarloop.exception;

/**
 * Base class for errors raised by the radar loop application. Unchecked so that
 * collaborators can be called from worker threads and UI callbacks alike.
 */
public class RadarLoopException extends RuntimeException {

    public RadarLoopException(String detailMessage) {
        super(detailMessage);
    }

    public RadarLoopException(String detailMessage, Throwable cause) {
        super(detailMessage, cause);
    }
}
