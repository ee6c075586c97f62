package com.radarloop.services;

/**
 * Read-only access to user settings. Missing or unparsable values fall back to the given default.
 */
public interface PreferenceStore {

    int getInt(String key, int defaultValue);

    String getString(String key, String defaultValue);

    boolean getBoolean(String key, boolean defaultValue);
}
