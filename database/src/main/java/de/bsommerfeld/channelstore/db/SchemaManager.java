package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.error.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single SQLite connection of a store and the schema behind it.
 *
 * <h3>Connection strategy</h3>
 * One connection is opened per store and held until {@link #close()}. The
 * entity repositories borrow it, they never open or close connections
 * themselves.
 *
 * <h3>Foreign keys</h3>
 * SQLite ships with foreign-key enforcement off and the setting is per
 * connection. {@link #open(Path, int)} switches it on right after connecting
 * and reads it back; if the engine does not report it as active, the open
 * fails instead of silently losing cascades.
 *
 * <h3>Schema</h3>
 * {@link #ensureSchema()} applies {@code schema.sql} from the classpath. Every
 * statement is {@code CREATE ... IF NOT EXISTS}, so it runs on every start and
 * never touches existing rows.
 */
public class SchemaManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaManager.class);
    private static final String MEMORY_URL = "jdbc:sqlite::memory:";

    private final String dbUrl;
    private Connection connection;

    private SchemaManager(String dbUrl) {
        this.dbUrl = dbUrl;
    }

    /**
     * Opens or creates the database file, creating missing parent directories.
     *
     * @throws StorageUnavailableException if the file cannot be opened or
     *                                     foreign keys cannot be enabled
     */
    public static SchemaManager open(Path file, int busyTimeoutMs) {
        Path absolute = file.toAbsolutePath();
        try {
            Path parent = absolute.getParent();
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot create directory for database " + absolute, e);
        }
        SchemaManager manager = new SchemaManager("jdbc:sqlite:" + absolute);
        manager.connect(busyTimeoutMs);
        return manager;
    }

    /** Opens a private in-memory database that vanishes on {@link #close()}. */
    public static SchemaManager openInMemory(int busyTimeoutMs) {
        SchemaManager manager = new SchemaManager(MEMORY_URL);
        manager.connect(busyTimeoutMs);
        return manager;
    }

    private void connect(int busyTimeoutMs) {
        LOG.info("Opening database at {}", dbUrl);
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(busyTimeoutMs);

        Connection conn = null;
        try {
            conn = DriverManager.getConnection(dbUrl, config.toProperties());
            enableForeignKeys(conn);
            this.connection = conn;
        } catch (SQLException | StorageUnavailableException e) {
            if (conn != null) {
                try {
                    conn.close();
                } catch (SQLException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            if (e instanceof StorageUnavailableException unavailable)
                throw unavailable;
            throw new StorageUnavailableException("Cannot open database at " + dbUrl, e);
        }
    }

    private void enableForeignKeys(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(SqlLoader.load("enable-foreign-keys"));
            try (ResultSet rs = stmt.executeQuery(SqlLoader.load("check-foreign-keys"))) {
                if (!rs.next() || rs.getInt(1) != 1) {
                    throw new StorageUnavailableException(
                            "Foreign key enforcement could not be enabled for " + dbUrl, null);
                }
            }
        }
        LOG.debug("Foreign key enforcement active.");
    }

    /**
     * Applies {@code schema.sql} in one transaction. Splits on semicolons at
     * line ends and executes each statement on its own.
     *
     * @throws StorageUnavailableException if the schema cannot be applied, the
     *                                     transaction is rolled back
     */
    public void ensureSchema() {
        Connection conn = connection();
        String schemaSql = readSchema();
        try {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                    if (!sql.trim().isEmpty())
                        stmt.execute(sql.trim());
                }
                conn.commit();
            } catch (SQLException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Schema application failed for " + dbUrl, e);
        }
        LOG.info("Database schema applied.");
    }

    private String readSchema() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (in == null)
                throw new StorageUnavailableException("schema.sql not found in classpath", null);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to read schema.sql", e);
        }
    }

    /**
     * @throws IllegalStateException after {@link #close()}
     */
    public Connection connection() {
        if (connection == null)
            throw new IllegalStateException("Database connection is closed: " + dbUrl);
        return connection;
    }

    public boolean isOpen() {
        return connection != null;
    }

    public String url() {
        return dbUrl;
    }

    /**
     * Releases the connection. Safe to call more than once.
     */
    @Override
    public void close() {
        if (connection == null)
            return;
        try {
            connection.close();
            LOG.info("Closed database at {}", dbUrl);
        } catch (SQLException e) {
            LOG.error("Failed to close database at {}", dbUrl, e);
        } finally {
            connection = null;
        }
    }
}
