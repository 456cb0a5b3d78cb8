package org.musigma.futures;

import org.apiguardian.api.API;

import java.util.Objects;

/**
 * Immutable ordered pair, produced by zipping two futures.
 */
@API(status = API.Status.EXPERIMENTAL)
public final class Pair<A, B> {

    private final A left;
    private final B right;

    private Pair(final A left, final B right) {
        this.left = left;
        this.right = right;
    }

    public static <A, B> Pair<A, B> of(final A left, final B right) {
        return new Pair<>(left, right);
    }

    public A getLeft() {
        return left;
    }

    public B getRight() {
        return right;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Pair<?, ?> pair = (Pair<?, ?>) o;
        return Objects.equals(left, pair.left) &&
                Objects.equals(right, pair.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return "Pair{" + left + ", " + right + '}';
    }

}
