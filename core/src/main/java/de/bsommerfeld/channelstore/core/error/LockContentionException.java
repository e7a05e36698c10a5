package de.bsommerfeld.channelstore.core.error;

import de.bsommerfeld.channelstore.core.domain.EntityKind;

/**
 * Thrown when another process holds the database lock past the busy timeout.
 * The store never retries; callers may retry with backoff.
 */
public class LockContentionException extends StoreException {

    public LockContentionException(EntityKind kind, Throwable cause) {
        super(kind, "Database is locked by another writer", cause);
    }
}
