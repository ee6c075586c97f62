package com.radarloop.services;

import com.radarloop.exception.DecodeFailureException;
import com.radarloop.exception.FetchFailureException;
import com.radarloop.model.RadarScan;

import java.io.File;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Access to archived radar files for a site: listing, fetching to local storage and decoding.
 */
public interface RadarDataSource {

    /**
     * @return names of the files available for {@code site} that match {@code pattern}, in no particular order
     * @throws FetchFailureException if the listing itself cannot be obtained
     */
    List<String> listCandidates(String site, Pattern pattern);

    /**
     * Make {@code name} available locally, reporting transfer progress as it goes.
     *
     * @return the local copy
     */
    File fetch(String site, String name, FetchProgressListener listener) throws FetchFailureException;

    RadarScan decode(File localFile, String site) throws DecodeFailureException;

    /**
     * Release the memory held by a decoded scan. Safe to call more than once.
     */
    void free(RadarScan scan);
}
