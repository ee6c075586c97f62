package com.radarloop.services;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * A place Level II files can be listed and copied from.
 */
public interface RadarArchive {

    List<String> listNames(String site) throws IOException;

    /**
     * Copy {@code name} into {@code target}, reusing an existing complete copy where possible.
     */
    void download(String site, String name, File target, FetchProgressListener listener) throws IOException;

    String describe();
}
