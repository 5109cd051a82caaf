/*
 *  Tuple
 */
package net.genomicbreeding.util;

import java.util.Objects;

/**
 * Holds two values, for methods that produce a pair of results.
 */
public class Tuple<X, Y> {

    public final X x;
    public final Y y;

    /**
     * Instantiates a tuple object, which just holds 2 values
     *
     * @param x The first object
     * @param y The second object
     */
    public Tuple(X x, Y y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final Tuple<?, ?> other = (Tuple<?, ?>) obj;
        if (!Objects.equals(this.x, other.x)) {
            return false;
        }
        return Objects.equals(this.y, other.y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
