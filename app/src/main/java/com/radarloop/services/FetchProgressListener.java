package com.radarloop.services;

/**
 * Receives byte counts while a file is transferred. {@code bytesTotal} is -1 when unknown.
 */
public interface FetchProgressListener {

    void onProgress(long bytesRead, long bytesTotal);
}
