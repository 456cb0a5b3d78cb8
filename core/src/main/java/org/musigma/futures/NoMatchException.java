package org.musigma.futures;

import org.apiguardian.api.API;

import java.util.NoSuchElementException;

/**
 * Raised when a collect extractor or filter predicate rejects a success value.
 */
@API(status = API.Status.EXPERIMENTAL)
public class NoMatchException extends NoSuchElementException {

    public NoMatchException(final String message) {
        super(message);
    }

    static NoMatchException forValue(final Object value) {
        return new NoMatchException("no match for " + value);
    }
}
