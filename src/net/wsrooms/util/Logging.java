package net.wsrooms.util;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Logging {

    private static final String FORMAT_PROPERTY =
        "java.util.logging.SimpleFormatter.format";

    private Logging() {}

    /**
     * Install the one-line log format unless the user chose their own.
     * Must run before the first log record is formatted.
     */
    public static void initFormat() {
        if (System.getProperty(FORMAT_PROPERTY) != null) return;
        System.setProperty(FORMAT_PROPERTY,
                           "[%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL " +
                           "%4$s %3$s] %5$s%6$s%n");
    }

    /**
     * Set the level of the root logger and of all its handlers, so that
     * lowering it below INFO actually shows the extra records.
     * Names and numbers as understood by Level.parse() are accepted.
     */
    public static void setLevel(String name) {
        Level level = Level.parse(name.trim().toUpperCase(Locale.ROOT));
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) h.setLevel(level);
    }

    /**
     * Log anything that kills a thread to logger instead of stderr.
     */
    public static void captureExceptions(final Logger logger) {
        Thread.setDefaultUncaughtExceptionHandler(
            new Thread.UncaughtExceptionHandler() {
                public void uncaughtException(Thread t, Throwable exc) {
                    logger.log(Level.SEVERE, "Uncaught exception in " +
                               t.getName(), exc);
                }
            });
    }

}
