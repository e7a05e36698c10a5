package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.domain.EntityKind;
import de.bsommerfeld.channelstore.core.error.ForeignKeyException;
import de.bsommerfeld.channelstore.core.error.InvalidEnumException;
import de.bsommerfeld.channelstore.core.error.LockContentionException;
import de.bsommerfeld.channelstore.core.error.RequiredFieldException;
import de.bsommerfeld.channelstore.core.error.StoreException;
import de.bsommerfeld.channelstore.core.error.UniqueConstraintException;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Translates driver exceptions into the store's error taxonomy.
 *
 * <p>
 * The xerial driver reports extended result codes (e.g.
 * {@code SQLITE_CONSTRAINT_UNIQUE}). When only the primary code is available
 * the engine's message text decides, since SQLite always names the violated
 * constraint type there.
 */
final class SqliteErrors {

    private static final String UNIQUE = "UNIQUE constraint failed: ";
    private static final String NOT_NULL = "NOT NULL constraint failed: ";

    private SqliteErrors() {
    }

    static StoreException translate(EntityKind kind, SQLException e) {
        String code = e instanceof SQLiteException sqlite ? sqlite.getResultCode().name() : "";
        String message = e.getMessage() != null ? e.getMessage() : "";

        if (code.startsWith("SQLITE_BUSY") || code.startsWith("SQLITE_LOCKED")
                || message.contains("database is locked")) {
            return new LockContentionException(kind, e);
        }
        if (code.equals("SQLITE_CONSTRAINT_UNIQUE") || message.contains(UNIQUE)) {
            return new UniqueConstraintException(kind, column(message, UNIQUE), e);
        }
        if (code.equals("SQLITE_CONSTRAINT_FOREIGNKEY") || message.contains("FOREIGN KEY constraint failed")) {
            return new ForeignKeyException(kind, null, e);
        }
        if (code.equals("SQLITE_CONSTRAINT_CHECK") || message.contains("CHECK constraint failed")) {
            // site_type is the only CHECK-constrained column
            return new InvalidEnumException(kind, "site_type", null, e);
        }
        if (code.equals("SQLITE_CONSTRAINT_NOTNULL") || message.contains(NOT_NULL)) {
            return new RequiredFieldException(kind, column(message, NOT_NULL), e);
        }
        return new StoreException(kind, "Database operation failed: " + message, e);
    }

    /**
     * Pulls the column out of {@code "... failed: table.column"}. Returns
     * {@code null} when the message has no such suffix.
     */
    static String column(String message, String marker) {
        int start = message.indexOf(marker);
        if (start < 0)
            return null;
        String rest = message.substring(start + marker.length());
        int end = 0;
        while (end < rest.length()) {
            char c = rest.charAt(end);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '.'))
                break;
            end++;
        }
        String qualified = rest.substring(0, end);
        int dot = qualified.lastIndexOf('.');
        String column = dot >= 0 ? qualified.substring(dot + 1) : qualified;
        return column.isEmpty() ? null : column;
    }
}
