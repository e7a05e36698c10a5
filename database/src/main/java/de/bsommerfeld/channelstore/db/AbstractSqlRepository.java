package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.domain.EntityKind;
import de.bsommerfeld.channelstore.core.domain.Identified;
import de.bsommerfeld.channelstore.core.error.ForeignKeyException;
import de.bsommerfeld.channelstore.core.error.NotFoundException;
import de.bsommerfeld.channelstore.core.error.RequiredFieldException;
import de.bsommerfeld.channelstore.core.error.StoreException;
import de.bsommerfeld.channelstore.core.event.ApplicationEventBus;
import de.bsommerfeld.channelstore.core.event.StoreEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared SQLite implementation of {@link EntityRepository}. Subclasses only
 * describe their columns: how to validate, bind and map a record, and which
 * parent it points to.
 *
 * <h3>Transaction boundaries</h3>
 * Every write runs in its own transaction: existence checks, the statement
 * itself and the id lookup either all commit or all roll back. Reads run in
 * auto-commit mode.
 *
 * <h3>Statements</h3>
 * All SQL comes from {@link SqlLoader}, all values are bound through
 * {@link PreparedStatement} parameters.
 */
public abstract class AbstractSqlRepository<E extends Identified> implements EntityRepository<E> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSqlRepository.class);

    private final Connection connection;
    private final ApplicationEventBus eventBus;
    private final EntityKind kind;

    protected AbstractSqlRepository(Connection connection, ApplicationEventBus eventBus, EntityKind kind) {
        this.connection = connection;
        this.eventBus = eventBus;
        this.kind = kind;
    }

    /** Throws {@link RequiredFieldException} for the first missing field. */
    protected abstract void validate(E entity);

    /** @return the parent id referenced by {@code entity}, or {@code null} for root kinds */
    protected abstract Long parentId(E entity);

    /**
     * Binds all data columns starting at parameter 1.
     *
     * @return the next free parameter index
     */
    protected abstract int bind(PreparedStatement ps, E entity) throws SQLException;

    protected abstract E map(ResultSet rs) throws SQLException;

    @Override
    public EntityKind kind() {
        return kind;
    }

    @Override
    public List<E> list() {
        return read("list", conn -> {
            List<E> rows = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.loadSelectAll(kind));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    rows.add(map(rs));
            }
            return rows;
        });
    }

    @Override
    public E get(long id) {
        return read("get", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select", kind))) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? map(rs) : null;
                }
            }
        });
    }

    @Override
    public long create(E entity) {
        validate(entity);
        long id = write("create", conn -> {
            requireParent(conn, entity);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert", kind))) {
                bind(ps, entity);
                ps.executeUpdate();
            }
            return lastInsertId(conn);
        });
        LOG.debug("[DB] Created {} id={}", kind.label(), id);
        eventBus.post(new StoreEvents.EntityCreated(kind, id));
        return id;
    }

    @Override
    public void update(long id, E entity) {
        validate(entity);
        write("update", conn -> {
            if (!exists(conn, kind, id))
                throw new NotFoundException(kind, id);
            requireParent(conn, entity);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update", kind))) {
                int next = bind(ps, entity);
                ps.setLong(next, id);
                ps.executeUpdate();
            }
            return null;
        });
        LOG.debug("[DB] Updated {} id={}", kind.label(), id);
        eventBus.post(new StoreEvents.EntityUpdated(kind, id));
    }

    @Override
    public void delete(long id) {
        write("delete", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete", kind))) {
                ps.setLong(1, id);
                if (ps.executeUpdate() == 0)
                    throw new NotFoundException(kind, id);
            }
            return null;
        });
        LOG.debug("[DB] Deleted {} id={} (children cascade)", kind.label(), id);
        eventBus.post(new StoreEvents.EntityDeleted(kind, id));
    }

    // =====================================================================
    // Helpers for subclasses
    // =====================================================================

    protected final void requireText(String value, String field) {
        if (value == null || value.isBlank())
            throw new RequiredFieldException(kind, field);
    }

    protected final void requirePresent(Object value, String field) {
        if (value == null)
            throw new RequiredFieldException(kind, field);
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private void requireParent(Connection conn, E entity) throws SQLException {
        Long parentId = parentId(entity);
        if (parentId != null && !exists(conn, kind.parent(), parentId))
            throw new ForeignKeyException(kind, parentId);
    }

    private static boolean exists(Connection conn, EntityKind target, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("exists", target))) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static long lastInsertId(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("last-insert-id"));
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next())
                throw new SQLException("No row id after insert");
            return rs.getLong(1);
        }
    }

    private <T> T read(String operation, SqlWork<T> work) {
        try {
            return work.run(connection);
        } catch (SQLException e) {
            throw failed(operation, SqliteErrors.translate(kind, e));
        }
    }

    /**
     * Runs {@code work} in a transaction on the shared connection. Any failure,
     * checked or not, rolls back before it propagates.
     */
    private <T> T write(String operation, SqlWork<T> work) {
        try {
            connection.setAutoCommit(false);
            try {
                T result = work.run(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw failed(operation, SqliteErrors.translate(kind, e));
        } catch (StoreException e) {
            throw failed(operation, e);
        }
    }

    private StoreException failed(String operation, StoreException e) {
        LOG.warn("[DB] {} {} failed: {}", kind.label(), operation, e.getMessage());
        return e;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }
}
