package com.radarloop.app;

/**
 * Setting keys and their defaults. The defaults here match {@code radarloop.properties}.
 */
public final class Settings {

    public static final String KEY_PREF_ANIMATION_FRAME_INTERVAL_MS = "pref_animation_frame_interval_ms";
    public static final String KEY_PREF_ANIMATION_END_HOLD_MS = "pref_animation_end_hold_ms";
    public static final String KEY_PREF_ANIMATION_MAX_FRAMES = "pref_animation_max_frames";
    public static final String KEY_PREF_NEXRAD_MERGE_SPLIT_CUTS_OFF = "pref_nexrad_merge_split_cuts_off";
    public static final String KEY_PREF_NEXRAD_URL = "pref_nexrad_url";
    public static final String KEY_PREF_NEXRAD_OFFLINE = "pref_nexrad_offline";
    public static final String KEY_PREF_NEXRAD_FTP_EMAIL = "pref_nexrad_ftp_email";
    public static final String KEY_PREF_CACHE_DIR = "pref_cache_dir";
    public static final String KEY_PREF_SHUTDOWN_POLL_MS = "pref_shutdown_poll_ms";
    public static final String KEY_PREF_DEFAULT_SITE = "pref_default_site";

    public static final int DEFAULT_FRAME_INTERVAL_MS = 500;
    public static final int DEFAULT_END_HOLD_MS = 1500;
    public static final int DEFAULT_MAX_FRAMES = 10;
    public static final String DEFAULT_NEXRAD_URL = "https://mesonet.agron.iastate.edu/data/nexrd2/raw";
    public static final String DEFAULT_CACHE_DIR = "~/.radarloop/cache";
    public static final int DEFAULT_SHUTDOWN_POLL_MS = 100;
    public static final String DEFAULT_SITE = "KTLX";

    /** Location of the optional per-user settings file. */
    public static final String USER_SETTINGS_FILE = "~/.radarloop/radarloop.properties";

    private Settings() {
    }
}
