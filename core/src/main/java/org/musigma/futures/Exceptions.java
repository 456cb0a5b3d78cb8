package org.musigma.futures;

import org.apiguardian.api.API;

/**
 * Exception utilities for dealing with checked and fatal exceptions.
 */
@API(status = API.Status.INTERNAL)
public final class Exceptions {

    private Exceptions() {
    }

    /**
     * Rethrows the given Throwable without being a checked exception or wrapping.
     */
    @SuppressWarnings("unchecked")
    public static <T extends Throwable> void rethrowUnchecked(final Throwable t) throws T {
        throw (T) t;
    }

    /**
     * Indicates if the given Throwable is fatal. Fatal throwables are never captured into a {@link Failure}.
     * An {@link InterruptedException} is not fatal; see {@link #restoreInterrupt(Throwable)}.
     *
     * @see VirtualMachineError
     * @see ThreadDeath
     * @see LinkageError
     */
    @SuppressWarnings("deprecation")
    public static boolean isFatal(final Throwable t) {
        return t instanceof VirtualMachineError || t instanceof ThreadDeath || t instanceof LinkageError;
    }

    /**
     * Re-asserts the interrupt status of the current thread if the given Throwable is an InterruptedException.
     * Call this whenever an error is captured rather than rethrown.
     */
    public static void restoreInterrupt(final Throwable t) {
        if (t instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Rethrows the given exception only if it's a fatal exception.
     */
    public static void rethrowIfFatal(final Throwable t) {
        if (isFatal(t)) {
            rethrowUnchecked(t);
        }
    }

    /**
     * Prepares the given Throwable for rethrowing from a method that declares no checked exceptions.
     * Errors are thrown directly, runtime exceptions are returned as-is and anything else is wrapped in a
     * {@link ComputationException}.
     */
    public static RuntimeException propagate(final Throwable t) {
        if (t instanceof RuntimeException) {
            return (RuntimeException) t;
        }
        if (t instanceof Error) {
            throw (Error) t;
        }
        return new ComputationException(t);
    }
}
