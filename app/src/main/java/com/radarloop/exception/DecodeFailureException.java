package com.radarloop.exception;

/**
 * A downloaded file could not be turned into a radar scan.
 */
public class DecodeFailureException extends RadarLoopException {

    public DecodeFailureException(String detailMessage) {
        super(detailMessage);
    }

    public DecodeFailureException(String detailMessage, Throwable cause) {
        super(detailMessage, cause);
    }
}
