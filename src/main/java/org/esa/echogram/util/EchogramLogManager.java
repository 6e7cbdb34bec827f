package org.esa.echogram.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Provides the system logger of the echogram processor.
 */
public final class EchogramLogManager {

    public static final String LOGGER_NAME = "org.esa.echogram";
    public static final String LOGGING_CONFIGURATION = "/echogram-logging.properties";

    private EchogramLogManager() {
    }

    public static Logger getSystemLogger() {
        return Logger.getLogger(LOGGER_NAME);
    }

    /**
     * Installs the logging configuration shipped with the processor.
     *
     * @return {@code true} if the configuration was found and read
     * @throws IOException if the configuration exists but cannot be read
     */
    public static boolean configure() throws IOException {
        try (InputStream stream = EchogramLogManager.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (stream == null) {
                return false;
            }
            LogManager.getLogManager().readConfiguration(stream);
            return true;
        }
    }
}
