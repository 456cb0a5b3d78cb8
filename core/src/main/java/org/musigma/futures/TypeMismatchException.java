package org.musigma.futures;

import org.apiguardian.api.API;

/**
 * Raised when a value consumed through {@link Try#cast(Class)} is not of the expected type.
 */
@API(status = API.Status.EXPERIMENTAL)
public class TypeMismatchException extends ClassCastException {

    private final Class<?> expected;
    private final Class<?> actual;

    public TypeMismatchException(final Class<?> expected, final Class<?> actual) {
        super("expected " + expected.getName() + " but got " + actual.getName());
        this.expected = expected;
        this.actual = actual;
    }

    public Class<?> getExpected() {
        return expected;
    }

    public Class<?> getActual() {
        return actual;
    }
}
