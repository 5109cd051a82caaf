/*
 *  GBPrefsTest
 */
package net.genomicbreeding.prefs;

import org.apache.log4j.Logger;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GBPrefsTest {

    @Test
    void maxThreads() {
        int original = GBPrefs.getMaxThreads();
        assertFalse(GBPrefs.getPersistPreferences());
        try {
            GBPrefs.putMaxThreads(2);
            assertEquals(2, GBPrefs.getMaxThreads());
            assertThrows(IllegalArgumentException.class, () -> GBPrefs.putMaxThreads(0));
            assertEquals(2, GBPrefs.getMaxThreads());
        } finally {
            GBPrefs.putMaxThreads(original);
        }
    }

    @Test
    void logDebug() {
        assertFalse(GBPrefs.getLogDebug());
        try {
            GBPrefs.putLogDebug(true);
            assertTrue(GBPrefs.getLogDebug());
            assertTrue(Logger.getLogger(GBPrefsTest.class).isDebugEnabled());
        } finally {
            GBPrefs.putLogDebug(false);
        }
        assertFalse(Logger.getLogger(GBPrefsTest.class).isDebugEnabled());
    }

}
