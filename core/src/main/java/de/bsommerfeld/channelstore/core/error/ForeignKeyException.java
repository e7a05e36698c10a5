package de.bsommerfeld.channelstore.core.error;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

/**
 * Thrown when a child row references a parent that does not exist.
 */
public class ForeignKeyException extends StoreException {

    private final Long parentId;

    public ForeignKeyException(EntityKind kind, long parentId) {
        this(kind, Long.valueOf(parentId), null);
    }

    /**
     * @param parentId the missing parent, {@code null} when the engine rejected
     *                 the row without naming it
     */
    public ForeignKeyException(EntityKind kind, Long parentId, Throwable cause) {
        super(kind, kind.label() + " references a missing " + kind.parent().label()
                + (parentId != null ? " (id=" + parentId + ")" : ""), cause);
        this.parentId = parentId;
    }

    public EntityKind parentKind() {
        return kind().parent();
    }

    public Long parentId() {
        return parentId;
    }
}
