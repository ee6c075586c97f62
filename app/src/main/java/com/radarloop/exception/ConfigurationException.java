package com.radarloop.exception;

/**
 * A preference value makes it impossible to start an animation session (for
 * example a frame limit of zero). Never retried.
 */
public class ConfigurationException extends RadarLoopException {

    public ConfigurationException(String detailMessage) {
        super(detailMessage);
    }
}
