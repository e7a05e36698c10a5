package de.bsommerfeld.channelstore.core.error;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

/**
 * Thrown when a value falls outside a fixed enumeration.
 */
public class InvalidEnumException extends StoreException {

    private final String field;
    private final String value;

    public InvalidEnumException(EntityKind kind, String field, String value) {
        this(kind, field, value, null);
    }

    public InvalidEnumException(EntityKind kind, String field, String value, Throwable cause) {
        super(kind, (value != null ? "Invalid value '" + value + "'" : "Invalid value")
                + " for " + kind.label() + "." + field, cause);
        this.field = field;
        this.value = value;
    }

    public String field() {
        return field;
    }

    /** @return the rejected value, {@code null} when only the engine saw it */
    public String value() {
        return value;
    }
}
