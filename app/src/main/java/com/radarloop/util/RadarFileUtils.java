package com.radarloop.util;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for the local archive cache. Files live under {@code <cacheDir>/<SITE>/<name>}.
 */
public class RadarFileUtils {

    /** Level II archive names: {@code SITE_yyyyMMdd_HHmmss} with an optional compression or version suffix. */
    public static final Pattern LEVEL2_NAME_PATTERN = Pattern.compile("^\\w{4}_\\d{8}_\\d{6}(\\.bz2|\\.gz|_V0\\d)?$");

    public static File siteDir(File cacheDir, String site) {
        return new File(cacheDir, site.toUpperCase());
    }

    public static File cacheFile(File cacheDir, String site, String name) throws IOException {
        File dir = siteDir(cacheDir, site);
        FileUtils.forceMkdir(dir);
        return new File(dir, name);
    }

    /**
     * A cached copy can be reused when it is present and, if the remote size is known, the same size.
     */
    public static boolean isCachedCopyUsable(File file, long expectedSize) {
        if (!file.isFile() || !file.canRead() || file.length() == 0) {
            return false;
        }
        return expectedSize <= 0 || file.length() == expectedSize;
    }

    /**
     * Names of cached archive files for a site, in directory order.
     */
    public static List<String> listCachedNames(File cacheDir, String site, Pattern pattern) {
        List<String> names = new ArrayList<String>();
        File[] files = siteDir(cacheDir, site).listFiles();
        if (files == null) {
            return names;
        }
        for (File eachFile : files) {
            if (eachFile.isFile() && pattern.matcher(eachFile.getName()).matches()) {
                names.add(eachFile.getName());
            }
        }
        return names;
    }

    /**
     * Expand a leading {@code ~} to the user's home directory.
     */
    public static File expandHome(String path) {
        if (path.startsWith("~")) {
            return new File(System.getProperty("user.home") + path.substring(1));
        }
        return new File(path);
    }
}
