package de.bsommerfeld.channelstore.core.error;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

/**
 * Thrown when an insert or update collides with an existing unique value.
 */
public class UniqueConstraintException extends StoreException {

    private final String field;

    public UniqueConstraintException(EntityKind kind, String field, Throwable cause) {
        super(kind, kind.label() + " with the same " + (field != null ? field : "unique value")
                + " already exists", cause);
        this.field = field;
    }

    /** @return the colliding column, or {@code null} if the engine did not name it */
    public String field() {
        return field;
    }
}
