package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resources under {@code sql/}.
 *
 * <p>
 * Files follow {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code insert-channel.sql} or {@code select-all-sites.sql}. Each file is read
 * once and kept for the lifetime of the JVM.
 *
 * @see AbstractSqlRepository
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the trimmed statement from {@code sql/<name>.sql}.
     *
     * @param name the file stem without directory or extension
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Returns the statement for a per-kind operation, e.g.
     * {@code load("delete", EntityKind.SOURCE)} reads {@code delete-source.sql}.
     */
    public static String load(String operation, EntityKind kind) {
        return load(operation + "-" + kind.name().toLowerCase(Locale.ROOT));
    }

    /** Loads {@code select-all-<table>.sql}, e.g. {@code select-all-channels.sql}. */
    public static String loadSelectAll(EntityKind kind) {
        return load("select-all-" + kind.table());
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
