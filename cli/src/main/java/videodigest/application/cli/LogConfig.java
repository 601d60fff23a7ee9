package videodigest.application.cli;

import videodigest.domain.logger.Loggers;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class LogConfig {
    /**
     * The console handler is created before any of our code runs, so it has to be given the compact
     * single line format explicitly.
     */
    public static void init() {
        System.setProperty("java.util.logging.SimpleFormatter.format", Loggers.LOG_FORMAT);

        final Logger rootLogger = LogManager.getLogManager().getLogger("");
        rootLogger.setLevel(Level.INFO);
        for (final Handler h : rootLogger.getHandlers()) {
            h.setLevel(Level.INFO);
            h.setFormatter(new SimpleFormatter());
        }
        // Weld and RESTEasy are chatty at INFO
        Logger.getLogger("org.jboss").setLevel(Level.WARNING);
    }
}
