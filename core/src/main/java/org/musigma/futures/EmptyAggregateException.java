package org.musigma.futures;

import org.apiguardian.api.API;

/**
 * Raised by aggregate operations that have no defined result for zero inputs.
 */
@API(status = API.Status.EXPERIMENTAL)
public class EmptyAggregateException extends UnsupportedOperationException {

    public EmptyAggregateException(final String operation) {
        super(operation + " of empty collection of futures");
    }

}
