package de.bsommerfeld.channelstore.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings of the configuration store, persisted as {@code config.toml} in
 * the app data directory. Unknown keys are ignored so older files keep
 * loading.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreConfig {

    public static final String APP_NAME = "channel-store";

    /** Database file, relative paths resolve against the app data directory. */
    @JsonProperty("database-file")
    private String databaseFile = "channels.db";

    /** How long SQLite waits on a lock held by another process before failing. */
    @JsonProperty("busy-timeout-ms")
    private int busyTimeoutMs = 3000;

    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }
}
