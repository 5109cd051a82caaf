/*
 * GBPrefs
 */
package net.genomicbreeding.prefs;

import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import org.apache.log4j.Logger;

import net.genomicbreeding.util.LoggingUtils;

/**
 * Process wide preferences. Values live in memory unless persistence is
 * turned on, in which case they are also read from and written to the user
 * preference store.
 */
public class GBPrefs {

    private static final Logger myLogger = Logger.getLogger(GBPrefs.class);

    public static final String GB_TOP = "/net/genomicbreeding";

    public static final String MAX_THREADS = "maxThreads";
    public static final int MAX_THREADS_DEFAULT = Runtime.getRuntime().availableProcessors();

    public static final String LOG_DEBUG = "logDebug";
    public static final boolean LOG_DEBUG_DEFAULT = false;

    private static boolean myPersistPreferences = false;
    private static int myMaxThreads = MAX_THREADS_DEFAULT;
    private static boolean myLogDebug = LOG_DEBUG_DEFAULT;

    private GBPrefs() {
        // utility
    }

    public static boolean getPersistPreferences() {
        return myPersistPreferences;
    }

    /**
     * Turns persistence on or off. Turning it on loads any stored values.
     */
    public static void setPersistPreferences(boolean persist) {
        myPersistPreferences = persist;
        if (persist) {
            Preferences node = getPreferences();
            myMaxThreads = node.getInt(MAX_THREADS, myMaxThreads);
            myLogDebug = node.getBoolean(LOG_DEBUG, myLogDebug);
        }
    }

    /**
     * Maximum number of worker threads used by parallel computations.
     */
    public static int getMaxThreads() {
        return myMaxThreads;
    }

    public static void putMaxThreads(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("GBPrefs: putMaxThreads: value must be at least 1: " + value);
        }
        myMaxThreads = value;
        if (myPersistPreferences) {
            Preferences node = getPreferences();
            node.putInt(MAX_THREADS, value);
            flush(node);
        }
    }

    public static boolean getLogDebug() {
        return myLogDebug;
    }

    /**
     * Switches debug logging on or off and reconfigures the loggers.
     */
    public static void putLogDebug(boolean value) {
        myLogDebug = value;
        if (myPersistPreferences) {
            Preferences node = getPreferences();
            node.putBoolean(LOG_DEBUG, value);
            flush(node);
        }
        LoggingUtils.updateLevel();
    }

    private static Preferences getPreferences() {
        return Preferences.userRoot().node(GB_TOP);
    }

    private static void flush(Preferences node) {
        try {
            node.flush();
        } catch (BackingStoreException e) {
            myLogger.debug(e.getMessage(), e);
            myLogger.warn("GBPrefs: flush: preferences could not be saved: " + e.getMessage());
        }
    }

}
