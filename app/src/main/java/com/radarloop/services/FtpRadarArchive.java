package com.radarloop.services;

import com.radarloop.exception.ConfigurationException;
import com.radarloop.util.RadarFileUtils;
import org.apache.commons.io.FileUtils;
import org.apache.commons.net.io.CopyStreamAdapter;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPClientConfig;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.validator.routines.EmailValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Level II archive on an anonymous FTP server, laid out as {@code <path>/<SITE>/<name>}.
 * A new connection is made for each operation.
 */
public class FtpRadarArchive implements RadarArchive {

    public static final String TAG = "FTPARCHIVE";
    protected static final int TIMEOUT_MS = 20000;

    private static final Logger LOG = LogManager.getLogger(TAG);

    protected final String ftpHost;
    protected final int ftpPort;
    protected final String ftpDir;
    protected final String eMailAddress;
    protected final Map<String, Long> knownSizes = new ConcurrentHashMap<String, Long>();

    public FtpRadarArchive(String ftpUrl, String eMailAddress) {
        if ((eMailAddress == null) || (!EmailValidator.getInstance().isValid(eMailAddress))) {
            throw new ConfigurationException("FTP archive needs a valid email address in settings, got [" + eMailAddress + "]");
        }
        try {
            URI uri = new URI(ftpUrl);
            this.ftpHost = uri.getHost();
            this.ftpPort = uri.getPort() > 0 ? uri.getPort() : FTPClient.DEFAULT_PORT;
            String path = uri.getPath() == null ? "" : uri.getPath();
            this.ftpDir = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        } catch (URISyntaxException ex) {
            throw new ConfigurationException("bad FTP archive URL [" + ftpUrl + "]: " + ex.getMessage());
        }
        if (ftpHost == null) {
            throw new ConfigurationException("no host in FTP archive URL [" + ftpUrl + "]");
        }
        this.eMailAddress = eMailAddress;
    }

    @Override
    public List<String> listNames(String site) throws IOException {
        FTPClient ftpClient = newClient();
        try {
            initFtp(ftpClient);
            changeToSiteDir(ftpClient, site);
            List<String> names = new ArrayList<String>();
            for (FTPFile file : ftpClient.listFiles()) {
                if (file.isFile() && RadarFileUtils.LEVEL2_NAME_PATTERN.matcher(file.getName()).matches()) {
                    names.add(file.getName());
                    knownSizes.put(site.toUpperCase() + "/" + file.getName(), file.getSize());
                }
            }
            return names;
        } finally {
            closeQuietly(ftpClient);
        }
    }

    @Override
    public void download(String site, String name, File target, final FetchProgressListener listener) throws IOException {
        Long expected = knownSizes.get(site.toUpperCase() + "/" + name);
        final long expectedSize = expected == null ? -1 : expected;
        if (RadarFileUtils.isCachedCopyUsable(target, expectedSize)) {
            if (listener != null) {
                listener.onProgress(target.length(), target.length());
            }
            return;
        }
        FTPClient ftpClient = newClient();
        File partial = new File(target.getParentFile(), target.getName() + ".part");
        try {
            initFtp(ftpClient);
            changeToSiteDir(ftpClient, site);
            if (listener != null) {
                ftpClient.setCopyStreamListener(new CopyStreamAdapter() {
                    @Override
                    public void bytesTransferred(long totalBytesTransferred, int bytesTransferred, long streamSize) {
                        listener.onProgress(totalBytesTransferred, expectedSize);
                    }
                });
            }
            OutputStream os = new FileOutputStream(partial);
            boolean ok;
            try {
                ok = ftpClient.retrieveFile(name, os);
            } finally {
                os.close();
            }
            if (!ok) {
                throw new IOException("data transfer error for " + ftpDir + "/" + site + "/" + name + " reply:" + ftpClient.getReplyString());
            }
            FileUtils.deleteQuietly(target);
            FileUtils.moveFile(partial, target);
        } finally {
            FileUtils.deleteQuietly(partial);
            closeQuietly(ftpClient);
        }
    }

    @Override
    public String describe() {
        return "ftp://" + ftpHost + ftpDir;
    }

    protected FTPClient newClient() {
        FTPClientConfig conf = new FTPClientConfig(FTPClientConfig.SYST_UNIX);
        conf.setServerTimeZoneId("UTC");
        FTPClient ftpClient = new FTPClient();
        ftpClient.configure(conf);
        ftpClient.setDataTimeout(TIMEOUT_MS);
        ftpClient.setConnectTimeout(TIMEOUT_MS);
        ftpClient.setDefaultTimeout(TIMEOUT_MS);
        return ftpClient;
    }

    private void initFtp(FTPClient ftpClient) throws IOException {
        ftpClient.connect(InetAddress.getByName(ftpHost), ftpPort);
        ftpClient.enterLocalPassiveMode();
        if (!ftpClient.login("anonymous", eMailAddress)) {
            throw new IOException("anonymous login refused by " + ftpHost + ": " + ftpClient.getReplyString());
        }
        ftpClient.setFileType(FTP.BINARY_FILE_TYPE);
    }

    private void changeToSiteDir(FTPClient ftpClient, String site) throws IOException {
        String dir = ftpDir + "/" + site.toUpperCase();
        if (!ftpClient.changeWorkingDirectory(dir)) {
            throw new IOException("cannot select download directory " + dir + " on FTP server");
        }
    }

    private void closeQuietly(FTPClient ftpClient) {
        if (!ftpClient.isConnected()) {
            return;
        }
        try {
            ftpClient.logout();
            ftpClient.disconnect();
        } catch (IOException ex) {
            LOG.debug("error closing FTP connection to " + ftpHost, ex);
        }
    }
}
