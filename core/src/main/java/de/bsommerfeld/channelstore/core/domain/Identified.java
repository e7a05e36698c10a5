package de.bsommerfeld.channelstore.core.domain;

/**
 * Anything persisted under a storage-assigned identity. The id is
 * {@code null} for drafts that have not been inserted yet.
 */
public interface Identified {

    Long id();

    default boolean isPersisted() {
        return id() != null;
    }
}
