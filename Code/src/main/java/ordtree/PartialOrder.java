package ordtree;

import java.util.Comparator;
import java.util.Objects;

/**
 * Ordering used to route values through an {@link OrderedTree}.
 * A total order never answers {@link Relation#INCOMPARABLE}.
 */
@FunctionalInterface
public interface PartialOrder<T> {

    /** Relates {@code a} to {@code b}: {@code LESS} means {@code a < b}. */
    Relation relate(T a, T b);

    static <T extends Comparable<? super T>> PartialOrder<T> natural() {
        return (a, b) -> Relation.of(a.compareTo(b));
    }

    static <T> PartialOrder<T> of(final Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return (a, b) -> Relation.of(comparator.compare(a, b));
    }
}
