package org.musigma.futures.function;

import org.apiguardian.api.API;

/**
 * Side-effecting callback that may throw checked exceptions.
 */
@FunctionalInterface
@API(status = API.Status.EXPERIMENTAL)
public interface UncheckedConsumer<T> {
    void accept(final T value) throws Exception;
}
