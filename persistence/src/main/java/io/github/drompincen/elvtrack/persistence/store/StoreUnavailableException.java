package io.github.drompincen.elvtrack.persistence.store;

/** The backing store could not be reached. Fatal for the request that hit it; never retried here. */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
