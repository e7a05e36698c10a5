package de.bsommerfeld.channelstore.core.error;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

/**
 * Thrown when a required field is missing or blank.
 */
public class RequiredFieldException extends StoreException {

    private final String field;

    public RequiredFieldException(EntityKind kind, String field) {
        this(kind, field, null);
    }

    public RequiredFieldException(EntityKind kind, String field, Throwable cause) {
        super(kind, kind.label() + "." + field + " is required", cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
