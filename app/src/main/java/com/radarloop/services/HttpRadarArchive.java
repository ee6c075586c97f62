package com.radarloop.services;

import com.radarloop.util.RadarFileUtils;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Level II archive published over HTTP. Each site directory carries a {@code dir.list} index
 * whose lines read {@code "<size> <name>"}.
 */
public class HttpRadarArchive implements RadarArchive {

    public static final String TAG = "HTTPARCHIVE";
    protected static final String DIRECTORY_INDEX = "dir.list";
    protected static final int TIMEOUT_MS = 20000;
    protected static final int BUFFER_SIZE = 64 * 1024;

    private static final Logger LOG = LogManager.getLogger(TAG);

    protected final String baseUrl;

    /** Sizes from the most recent listing of each site, used to validate cached copies. */
    protected final Map<String, Long> knownSizes = new ConcurrentHashMap<String, Long>();

    public HttpRadarArchive(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public List<String> listNames(String site) throws IOException {
        String urlString = baseUrl + "/" + site.toUpperCase() + "/" + DIRECTORY_INDEX;
        HttpURLConnection conn = open(new URL(urlString));
        List<String> lines;
        try {
            InputStream is = conn.getInputStream();
            try {
                lines = IOUtils.readLines(is, StandardCharsets.UTF_8);
            } finally {
                is.close();
            }
        } finally {
            conn.disconnect();
        }
        Map<String, Long> listing = parseDirectoryIndex(lines);
        for (Map.Entry<String, Long> entry : listing.entrySet()) {
            if (entry.getValue() > 0) {
                knownSizes.put(site.toUpperCase() + "/" + entry.getKey(), entry.getValue());
            }
        }
        LOG.debug("listed " + listing.size() + " files at " + urlString);
        return new ArrayList<String>(listing.keySet());
    }

    @Override
    public void download(String site, String name, File target, FetchProgressListener listener) throws IOException {
        Long expected = knownSizes.get(site.toUpperCase() + "/" + name);
        long expectedSize = expected == null ? -1 : expected;
        if (RadarFileUtils.isCachedCopyUsable(target, expectedSize)) {
            LOG.debug("reusing cached " + target);
            if (listener != null) {
                listener.onProgress(target.length(), target.length());
            }
            return;
        }
        HttpURLConnection conn = open(new URL(baseUrl + "/" + site.toUpperCase() + "/" + name));
        File partial = new File(target.getParentFile(), target.getName() + ".part");
        try {
            long total = conn.getContentLengthLong();
            InputStream is = conn.getInputStream();
            OutputStream os = new FileOutputStream(partial);
            try {
                byte[] buffer = new byte[BUFFER_SIZE];
                long read = 0;
                int count;
                while ((count = is.read(buffer)) != -1) {
                    os.write(buffer, 0, count);
                    read += count;
                    if (listener != null) {
                        listener.onProgress(read, total);
                    }
                }
            } finally {
                os.close();
                is.close();
            }
            FileUtils.deleteQuietly(target);
            FileUtils.moveFile(partial, target);
        } finally {
            conn.disconnect();
            FileUtils.deleteQuietly(partial);
        }
    }

    @Override
    public String describe() {
        return baseUrl;
    }

    /**
     * Open a GET connection, following at most one redirect.
     */
    protected HttpURLConnection open(URL url) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) url.openConnection();
        conn.setConnectTimeout(TIMEOUT_MS);
        conn.setReadTimeout(TIMEOUT_MS);
        conn.setInstanceFollowRedirects(true);
        conn.connect();
        int response = conn.getResponseCode();
        if ((response == HttpURLConnection.HTTP_MOVED_TEMP) ||
                (response == HttpURLConnection.HTTP_MOVED_PERM)) {
            String location = conn.getHeaderField("Location");
            conn.disconnect();
            conn = (HttpURLConnection) new URL(url, location).openConnection();
            conn.setConnectTimeout(TIMEOUT_MS);
            conn.setReadTimeout(TIMEOUT_MS);
            response = conn.getResponseCode();
        }
        if (response != HttpURLConnection.HTTP_OK) {
            conn.disconnect();
            throw new IOException("Bad HTTP response: " + response + " for " + url);
        }
        return conn;
    }

    /**
     * Parse a {@code dir.list} index. Lines that do not name a Level II file are ignored; a missing
     * or unreadable size is recorded as -1.
     *
     * @return name to size, in listing order
     */
    static Map<String, Long> parseDirectoryIndex(List<String> lines) {
        Map<String, Long> result = new LinkedHashMap<String, Long>();
        for (String line : lines) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) {
                continue;
            }
            String name = parts[parts.length - 1];
            if (!RadarFileUtils.LEVEL2_NAME_PATTERN.matcher(name).matches()) {
                continue;
            }
            long size = -1;
            if (parts.length > 1) {
                try {
                    size = Long.parseLong(parts[0]);
                } catch (NumberFormatException ex) {
                    LOG.debug("no size for " + name + " in [" + line + "]");
                }
            }
            result.put(name, size);
        }
        return result;
    }
}
