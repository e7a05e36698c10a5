package de.bsommerfeld.channelstore.core.error;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

/**
 * Thrown when an update or delete targets an id that does not exist.
 */
public class NotFoundException extends StoreException {

    private final long id;

    public NotFoundException(EntityKind kind, long id) {
        super(kind, kind.label() + " id=" + id + " not found");
        this.id = id;
    }

    public long id() {
        return id;
    }
}
