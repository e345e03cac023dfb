package com.novaware.catalog.store;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;

import java.net.ConnectException;
import java.nio.channels.ClosedChannelException;

/** Tells connection failures apart from per-record persistence errors. */
public final class StoreErrors {
    private StoreErrors() {}

    public static boolean isConnectionFailure(Throwable e) {
        Throwable t = e;
        int depth = 0;
        while (t != null && depth++ < 10) {
            if (t instanceof CatalogConnectionException
                    || t instanceof DataAccessResourceFailureException
                    || t instanceof TransientDataAccessResourceException
                    || t instanceof ConnectException
                    || t instanceof ClosedChannelException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    /** Wraps connection failures into {@link CatalogConnectionException}, passes others through. */
    public static Throwable translate(Throwable e) {
        if (e instanceof CatalogConnectionException) return e;
        return isConnectionFailure(e) ? new CatalogConnectionException(e) : e;
    }
}
