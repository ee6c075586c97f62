package com.radarloop.services;

import com.radarloop.util.RadarFileUtils;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;

/**
 * Offline mode: only files already in the cache directory are available.
 */
public class LocalRadarArchive implements RadarArchive {

    protected final File cacheDir;

    public LocalRadarArchive(File cacheDir) {
        this.cacheDir = cacheDir;
    }

    @Override
    public List<String> listNames(String site) {
        return RadarFileUtils.listCachedNames(cacheDir, site, RadarFileUtils.LEVEL2_NAME_PATTERN);
    }

    @Override
    public void download(String site, String name, File target, FetchProgressListener listener) throws IOException {
        if (!RadarFileUtils.isCachedCopyUsable(target, -1)) {
            throw new FileNotFoundException("offline and no cached copy of " + name);
        }
        if (listener != null) {
            listener.onProgress(target.length(), target.length());
        }
    }

    @Override
    public String describe() {
        return "offline cache " + cacheDir;
    }
}
