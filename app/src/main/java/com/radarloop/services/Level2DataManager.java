package com.radarloop.services;

import com.radarloop.app.Settings;
import com.radarloop.exception.ConfigurationException;
import com.radarloop.exception.DecodeFailureException;
import com.radarloop.exception.FetchFailureException;
import com.radarloop.model.RadarScan;
import com.radarloop.util.RadarFileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * This service handles the interface with the Level II data provider: it lists what an archive
 * has for a site, copies files into the local cache and decodes them.
 */
@Singleton
public class Level2DataManager implements RadarDataSource {

    public final static String TAG = "LEVEL2DATA";

    private static final Logger LOG = LogManager.getLogger(TAG);

    protected final RadarArchive archive;
    protected final File cacheDir;
    protected final Level2Decoder decoder;

    @Inject
    public Level2DataManager(PreferenceStore preferences) {
        this(createArchive(preferences),
                RadarFileUtils.expandHome(preferences.getString(Settings.KEY_PREF_CACHE_DIR, Settings.DEFAULT_CACHE_DIR)),
                new Level2Decoder(preferences.getBoolean(Settings.KEY_PREF_NEXRAD_MERGE_SPLIT_CUTS_OFF, false)));
    }

    public Level2DataManager(RadarArchive archive, File cacheDir, Level2Decoder decoder) {
        this.archive = archive;
        this.cacheDir = cacheDir;
        this.decoder = decoder;
        LOG.info("radar data from " + archive.describe() + ", cached in " + cacheDir);
    }

    /**
     * Pick the archive implementation from the offline flag or the URL scheme.
     */
    static RadarArchive createArchive(PreferenceStore preferences) {
        File cacheDir = RadarFileUtils.expandHome(preferences.getString(Settings.KEY_PREF_CACHE_DIR, Settings.DEFAULT_CACHE_DIR));
        if (preferences.getBoolean(Settings.KEY_PREF_NEXRAD_OFFLINE, false)) {
            return new LocalRadarArchive(cacheDir);
        }
        String url = preferences.getString(Settings.KEY_PREF_NEXRAD_URL, Settings.DEFAULT_NEXRAD_URL);
        if (url == null || url.trim().isEmpty()) {
            throw new ConfigurationException("no radar archive URL configured (" + Settings.KEY_PREF_NEXRAD_URL + ")");
        }
        url = url.trim();
        String lower = url.toLowerCase();
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new HttpRadarArchive(url);
        } else if (lower.startsWith("ftp://")) {
            return new FtpRadarArchive(url, preferences.getString(Settings.KEY_PREF_NEXRAD_FTP_EMAIL, null));
        }
        throw new ConfigurationException("unsupported radar archive URL [" + url + "]");
    }

    @Override
    public List<String> listCandidates(String site, Pattern pattern) {
        List<String> names;
        try {
            names = archive.listNames(site);
        } catch (IOException ex) {
            LOG.error("error listing files for " + site + " at " + archive.describe(), ex);
            throw new FetchFailureException(site, "cannot list files for " + site + ": " + ex.getMessage(), ex);
        }
        List<String> result = new ArrayList<String>();
        for (String name : names) {
            if (pattern == null || pattern.matcher(name).matches()) {
                result.add(name);
            }
        }
        return result;
    }

    @Override
    public File fetch(String site, String name, FetchProgressListener listener) throws FetchFailureException {
        try {
            File target = RadarFileUtils.cacheFile(cacheDir, site, name);
            archive.download(site, name, target, listener);
            return target;
        } catch (IOException ex) {
            throw new FetchFailureException(name, "transfer of " + name + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public RadarScan decode(File localFile, String site) throws DecodeFailureException {
        return decoder.decode(localFile, site);
    }

    @Override
    public void free(RadarScan scan) {
        if (scan != null) {
            scan.release();
        }
    }
}
