/*
 *  LoggingUtils
 */
package net.genomicbreeding.util;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.PrintStream;
import java.util.Properties;

import org.apache.log4j.Logger;
import org.apache.log4j.PropertyConfigurator;

import net.genomicbreeding.prefs.GBPrefs;

/**
 * Sends log4j output of the net.genomicbreeding loggers to the console, a
 * given stream or a log file. The level follows {@link GBPrefs#getLogDebug()}.
 */
public class LoggingUtils {

    private static final Logger myLogger = Logger.getLogger(LoggingUtils.class);
    private static final PrintStream myOriginalOutputStream = System.out;
    private static final PrintStream myOriginalErrStream = System.err;

    private static PrintStream myPrintStream;

    private LoggingUtils() {
        // Utility Class
    }

    public static void setupLogging() {
        System.setOut(myOriginalOutputStream);
        System.setErr(myOriginalErrStream);
        sendLog4jToStdout();
    }

    public static void setupLogging(PrintStream stream) {
        System.setOut(stream);
        System.setErr(stream);
        sendLog4jToStdout();
    }

    public static void setupLogfile(String logFileName) throws FileNotFoundException {
        File logFile = new File(logFileName);
        myLogger.info("Log File: " + logFile.getAbsolutePath());
        myPrintStream = new PrintStream(logFile);
        System.setOut(myPrintStream);
        System.setErr(myPrintStream);
        sendLog4jToStdout();
        basicLoggingInfo();
    }

    public static void closeLogfile() {
        if (myPrintStream != null) {
            myPrintStream.close();
            myPrintStream = null;
        }
        System.setOut(myOriginalOutputStream);
        System.setErr(myOriginalErrStream);
    }

    /**
     * Reapplies the level from the preferences to the current destination.
     */
    public static void updateLevel() {
        sendLog4jToStdout();
    }

    public static void basicLoggingInfo() {
        myLogger.info("Java Version: " + System.getProperty("java.version"));
        myLogger.info("OS: " + System.getProperty("os.name"));
        myLogger.info("Max Available Memory Reported by JVM: " + Runtime.getRuntime().maxMemory() / 1048576L + " MB");
        myLogger.info("Max Threads: " + GBPrefs.getMaxThreads());
    }

    // ConsoleAppender writes to System.out as it is when configured
    private static void sendLog4jToStdout() {
        String level = GBPrefs.getLogDebug() ? "DEBUG" : "INFO";
        Properties props = new Properties();
        props.setProperty("log4j.logger.net.genomicbreeding", level + ", stdout");
        props.setProperty("log4j.additivity.net.genomicbreeding", "false");
        props.setProperty("log4j.appender.stdout", "org.apache.log4j.ConsoleAppender");
        props.setProperty("log4j.appender.stdout.Threshold", level.toLowerCase());
        props.setProperty("log4j.appender.stdout.layout", "org.apache.log4j.TTCCLayout");
        PropertyConfigurator.configure(props);
    }

}
