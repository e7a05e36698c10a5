package de.bsommerfeld.channelstore.core.error;

/**
 * Thrown when the backing database cannot be opened or its schema cannot be
 * applied. Fatal: nothing else in the store works without it.
 */
public class StorageUnavailableException extends StoreException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
