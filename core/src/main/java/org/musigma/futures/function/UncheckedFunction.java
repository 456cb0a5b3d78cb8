package org.musigma.futures.function;

import org.apiguardian.api.API;

/**
 * Function that may throw checked exceptions. Thrown exceptions are reified as failures by the combinators
 * accepting it.
 */
@FunctionalInterface
@API(status = API.Status.EXPERIMENTAL)
public interface UncheckedFunction<T, R> {
    static <T> UncheckedFunction<T, T> identity() {
        return t -> t;
    }

    R apply(final T value) throws Exception;
}
