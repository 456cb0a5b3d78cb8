package org.musigma.futures.function;

import org.apiguardian.api.API;

/**
 * Two-argument function that may throw checked exceptions; used for zipping and for the combine step of
 * aggregate operations.
 */
@FunctionalInterface
@API(status = API.Status.EXPERIMENTAL)
public interface UncheckedBiFunction<T, U, R> {

    R apply(final T left, final U right) throws Exception;

}
