package de.bsommerfeld.channelstore.db;

import de.bsommerfeld.channelstore.core.domain.EntityKind;
import de.bsommerfeld.channelstore.core.domain.Identified;
import de.bsommerfeld.channelstore.core.error.ForeignKeyException;
import de.bsommerfeld.channelstore.core.error.InvalidEnumException;
import de.bsommerfeld.channelstore.core.error.NotFoundException;
import de.bsommerfeld.channelstore.core.error.RequiredFieldException;
import de.bsommerfeld.channelstore.core.error.UniqueConstraintException;

import java.util.List;

/**
 * CRUD contract for one level of the Channel → Source → Site hierarchy.
 *
 * <p>
 * Every call is synchronous and runs on the caller's thread. Writes are
 * committed before the method returns. Errors are never swallowed: each
 * failure surfaces as a subclass of
 * {@link de.bsommerfeld.channelstore.core.error.StoreException}.
 *
 * @param <E> the record type of this level
 */
public interface EntityRepository<E extends Identified> {

    EntityKind kind();

    /**
     * Returns every row, decoded, in insertion order. Callers must not rely on
     * any other ordering.
     */
    List<E> list();

    /**
     * Returns the row with the given id, or {@code null} if none exists.
     */
    E get(long id);

    /**
     * Inserts a new row. The id carried by {@code entity} is ignored.
     *
     * @return the id assigned by the database
     * @throws RequiredFieldException     if a required field is blank
     * @throws ForeignKeyException        if the referenced parent does not exist
     * @throws UniqueConstraintException  if a unique column collides
     * @throws InvalidEnumException       if an enumerated column is rejected
     */
    long create(E entity);

    /**
     * Replaces every field of the row {@code id} with those of {@code entity}.
     * The id carried by {@code entity} is ignored.
     *
     * @throws NotFoundException if no row has this id
     */
    void update(long id, E entity);

    /**
     * Deletes the row. Dependent children are removed by the database's
     * {@code ON DELETE CASCADE}.
     *
     * @throws NotFoundException if no row has this id, including a second
     *                           delete of the same id
     */
    void delete(long id);
}
