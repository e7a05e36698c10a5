package de.bsommerfeld.channelstore.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the store. {@link #TEST} keeps everything in an in-memory
 * database that disappears with the process; {@link #PROD} uses the
 * configured file.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code app.mode} system property, then the
     * {@code APP_MODE} environment variable. Unset or unknown values fall back
     * to PROD.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty("app.mode");
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv("APP_MODE");
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', using PROD.", mode);
            return PROD;
        }
    }

    public boolean isInMemory() {
        return this == TEST;
    }
}
