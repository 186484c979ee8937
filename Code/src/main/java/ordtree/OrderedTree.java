package ordtree;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Persistent, unbalanced binary search multiset.
 * <p>
 * Every {@link #insert} returns a new tree and leaves the receiver untouched, so a
 * published instance can be read by any number of threads without coordination.
 * Equal values are kept and ordered after the ones inserted before them.
 *
 * <pre>{@code
 * OrderedTree<Integer> t = OrderedTree.<Integer>empty().insert(3).insert(1).insert(2);
 * t.traverse();   // [1, 2, 3]
 * }</pre>
 */
public final class OrderedTree<T> implements Iterable<T> {
    private final PartialOrder<? super T> order;
    private final Tree<T> root;

    private OrderedTree(final PartialOrder<? super T> order, final Tree<T> root) {
        this.order = order;
        this.root = root;
    }

    public static <T extends Comparable<? super T>> OrderedTree<T> empty() {
        return new OrderedTree<>(PartialOrder.<T>natural(), Tree.empty());
    }

    public static <T> OrderedTree<T> empty(final PartialOrder<? super T> order) {
        return new OrderedTree<>(Objects.requireNonNull(order, "order"), Tree.empty());
    }

    public static <T> OrderedTree<T> empty(final Comparator<? super T> comparator) {
        return new OrderedTree<T>(PartialOrder.of(comparator), Tree.empty());
    }

    @SafeVarargs
    public static <T extends Comparable<? super T>> OrderedTree<T> of(final T... items) {
        return OrderedTree.<T>empty().insertAll(List.of(items));
    }

    //--------------------------------------------------------------------------------
    // PUBLIC METHODS:
    // - insert    : OrderedTree
    // - insertAll : OrderedTree
    // - traverse  : List
    //--------------------------------------------------------------------------------

    /**
     * PRECONDITION: item CANNOT BE NULL
     *
     * @throws IncomparableValuesException if the ordering cannot place {@code item};
     *         this tree stays valid and unchanged
     */
    public OrderedTree<T> insert(final T item) {
        return new OrderedTree<>(order, Trees.insert(item, root, order));
    }

    /** Inserts left to right. Either all items go in or the exception propagates with nothing returned. */
    public OrderedTree<T> insertAll(final Iterable<? extends T> items) {
        Tree<T> t = root;
        for (T item : items) {
            t = Trees.insert(item, t, order);
        }
        return (t == root) ? this : new OrderedTree<>(order, t);
    }

    /** Ascending snapshot of the contents; equal calls return equal lists. */
    public List<T> traverse() {
        return Trees.traverse(root);
    }

    @Override
    public Iterator<T> iterator() {
        return Trees.iterator(root);
    }

    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    //--------------------------------------------------------------------------------
    // QUERIES
    //--------------------------------------------------------------------------------

    public boolean isEmpty() {
        return root.isEmpty();
    }

    public int size() {
        return root.size();
    }

    /** Depth in nodes. Sorted insertion of n values gives n. */
    public int height() {
        return root.height();
    }

    public boolean contains(final T item) {
        return Trees.contains(item, root, order);
    }

    public int count(final T item) {
        return Trees.count(item, root, order);
    }

    /** 1-based position of the last occurrence of {@code item}, or of its predecessor; 0 if all values are greater. */
    public int rank(final T item) {
        return Trees.rank(item, root, order);
    }

    /** k-th smallest value, 1-based. */
    public T select(final int k) {
        return Trees.select(k, root);
    }

    public Tree<T> root() {
        return root;
    }

    public PartialOrder<? super T> order() {
        return order;
    }

    public void checkInvariants() {
        Trees.checkInvariants(root, order);
    }

    @Override
    public String toString() {
        return traverse().toString();
    }
}
