package com.radarloop.services;

import com.radarloop.exception.ConfigurationException;
import org.apache.commons.io.IOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Preferences backed by {@link Properties}: classpath defaults from {@code radarloop.properties},
 * overlaid by an optional user file.
 */
public class PropertiesPreferenceStore implements PreferenceStore {

    public static final String TAG = "PREFERENCES";
    public static final String DEFAULTS_RESOURCE = "/radarloop.properties";

    private static final Logger LOG = LogManager.getLogger(TAG);

    protected final Properties properties;

    public PropertiesPreferenceStore(Properties properties) {
        this.properties = properties;
    }

    /**
     * Load the bundled defaults, then the user file if it exists.
     *
     * @param userFile optional override file, may be null
     */
    public static PropertiesPreferenceStore load(File userFile) {
        Properties properties = new Properties();
        InputStream defaults = PropertiesPreferenceStore.class.getResourceAsStream(DEFAULTS_RESOURCE);
        if (defaults != null) {
            try {
                properties.load(defaults);
            } catch (IOException ex) {
                throw new ConfigurationException("cannot read default settings " + DEFAULTS_RESOURCE + ": " + ex);
            } finally {
                IOUtils.closeQuietly(defaults);
            }
        } else {
            LOG.warn("no bundled defaults found at " + DEFAULTS_RESOURCE);
        }
        if (userFile != null && userFile.isFile()) {
            InputStream userStream = null;
            try {
                userStream = new FileInputStream(userFile);
                properties.load(userStream);
                LOG.info("loaded settings from " + userFile);
            } catch (IOException ex) {
                throw new ConfigurationException("cannot read settings file " + userFile + ": " + ex);
            } finally {
                IOUtils.closeQuietly(userStream);
            }
        }
        return new PropertiesPreferenceStore(properties);
    }

    @Override
    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            LOG.warn("setting " + key + " is not a number: [" + value + "], using " + defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    @Override
    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }
}
