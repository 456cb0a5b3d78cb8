package org.musigma.futures;

import org.apiguardian.api.API;

/**
 * Unchecked wrapper for a checked exception raised by a producer when its result is forced.
 */
@API(status = API.Status.EXPERIMENTAL)
public class ComputationException extends RuntimeException {

    public ComputationException(final Throwable cause) {
        super(cause.getMessage(), cause);
    }

}
