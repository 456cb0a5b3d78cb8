package org.musigma.futures.function;

import org.apiguardian.api.API;

@FunctionalInterface
@API(status = API.Status.EXPERIMENTAL)
public interface UncheckedPredicate<T> {
    boolean test(final T value) throws Exception;
}
