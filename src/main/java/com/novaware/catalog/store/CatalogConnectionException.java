package com.novaware.catalog.store;

/**
 * The catalog database could not be reached. Fatal to the running pipeline: batches already
 * committed stay in place, later ones are not processed.
 */
public class CatalogConnectionException extends RuntimeException {
    public CatalogConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public CatalogConnectionException(Throwable cause) {
        super("catalog store unreachable: " + cause, cause);
    }
}
