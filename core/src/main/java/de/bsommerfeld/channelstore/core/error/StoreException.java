package de.bsommerfeld.channelstore.core.error;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

/**
 * Base of every failure the configuration store reports. Subclasses carry the
 * offending id or field so a front end can point the operator at it.
 */
public class StoreException extends RuntimeException {

    private final EntityKind kind;

    public StoreException(EntityKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(EntityKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** @return the entity kind involved, or {@code null} if not tied to one */
    public EntityKind kind() {
        return kind;
    }
}
