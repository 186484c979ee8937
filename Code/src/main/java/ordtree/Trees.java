package ordtree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Operations over {@link Tree} values. None of them modify their input.
 * <p>
 * Every walk is iterative: trees built from sorted input are as deep as they are large.
 */
public final class Trees {
    private static final Logger LOGGER = LoggerFactory.getLogger(Trees.class);

    private Trees() {}

    public static <T> Tree<T> empty() {
        return Tree.empty();
    }

    //--------------------------------------------------------------------------------
    // INSERT
    //--------------------------------------------------------------------------------

    /** Inserts under natural ordering. PRECONDITION: item CANNOT BE NULL */
    public static <T extends Comparable<? super T>> Tree<T> insert(final T item, final Tree<T> tree) {
        return insert(item, tree, PartialOrder.natural());
    }

    /**
     * Returns a tree holding every value of {@code tree} plus {@code item}.
     * Values less than a node go left; equal or greater go right, so duplicates are kept.
     * No rebalancing is done: the shape follows insertion order.
     * <p>
     * The search path is copied, everything off the path is shared with {@code tree}.
     * All comparisons happen before the first node is built, so a failing ordering
     * leaves nothing half-constructed.
     *
     * @throws IncomparableValuesException if {@code order} cannot relate {@code item} to a value on its path
     */
    public static <T> Tree<T> insert(final T item, final Tree<T> tree, final PartialOrder<? super T> order) {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(order, "order");

        /** SEARCH **/
        final ArrayDeque<Tree.Node<T>> path = new ArrayDeque<>();
        final boolean[] wentLeft = new boolean[tree.height()];
        int depth = 0;
        Tree<T> t = tree;
        while (t.getClass() == Tree.Node.class) {
            final Tree.Node<T> n = (Tree.Node<T>) t;
            final Relation r = order.relate(item, n.value);
            if (r == Relation.INCOMPARABLE) throw new IncomparableValuesException(item, n.value);
            path.push(n);
            wentLeft[depth] = (r == Relation.LESS);
            t = wentLeft[depth] ? n.left : n.right;
            depth++;
        }
        /** END SEARCH **/

        // rebuild the path bottom-up around the new leaf
        Tree<T> rebuilt = new Tree.Node<>(item, Tree.empty(), Tree.empty());
        for (int i = depth - 1; i >= 0; i--) {
            final Tree.Node<T> n = path.pop();
            rebuilt = wentLeft[i]
                    ? new Tree.Node<>(n.value, rebuilt, n.right)
                    : new Tree.Node<>(n.value, n.left, rebuilt);
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Inserted {} at depth {}; size={} height={}", item, depth + 1, rebuilt.size(), rebuilt.height());
        }
        return rebuilt;
    }

    //--------------------------------------------------------------------------------
    // TRAVERSAL
    //--------------------------------------------------------------------------------

    /** In-order values of {@code tree}, ascending, duplicates included. */
    public static <T> List<T> traverse(final Tree<T> tree) {
        final List<T> out = new ArrayList<>(tree.size());
        final Iterator<T> it = iterator(tree);
        while (it.hasNext()) out.add(it.next());
        return Collections.unmodifiableList(out);
    }

    public static <T> Iterator<T> iterator(final Tree<T> tree) {
        return new InOrderIterator<>(tree);
    }

    private static final class InOrderIterator<T> implements Iterator<T> {
        private final ArrayDeque<Tree.Node<T>> stack = new ArrayDeque<>();

        InOrderIterator(final Tree<T> root) {
            pushLeftSpine(root);
        }

        private void pushLeftSpine(Tree<T> t) {
            while (t.getClass() == Tree.Node.class) {
                final Tree.Node<T> n = (Tree.Node<T>) t;
                stack.push(n);
                t = n.left;
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public T next() {
            if (stack.isEmpty()) throw new NoSuchElementException();
            final Tree.Node<T> n = stack.pop();
            pushLeftSpine(n.right);
            return n.value;
        }
    }

    //--------------------------------------------------------------------------------
    // QUERIES
    //--------------------------------------------------------------------------------

    public static <T> boolean contains(final T item, final Tree<T> tree, final PartialOrder<? super T> order) {
        Objects.requireNonNull(item, "item");
        Tree<T> t = tree;
        while (t.getClass() == Tree.Node.class) {
            final Tree.Node<T> n = (Tree.Node<T>) t;
            switch (relate(item, n.value, order)) {
                case LESS:
                    t = n.left;
                    break;
                case EQUAL:
                    return true;
                default:
                    t = n.right;
            }
        }
        return false;
    }

    /** Number of stored values equal to {@code item}. */
    public static <T> int count(final T item, final Tree<T> tree, final PartialOrder<? super T> order) {
        Objects.requireNonNull(item, "item");
        int count = 0;
        Tree<T> t = tree;
        while (t.getClass() == Tree.Node.class) {
            final Tree.Node<T> n = (Tree.Node<T>) t;
            final Relation r = relate(item, n.value, order);
            if (r == Relation.EQUAL) count++;
            t = (r == Relation.LESS) ? n.left : n.right;
        }
        return count;
    }

    /** Number of stored values less than or equal to {@code item}. */
    public static <T> int rank(final T item, final Tree<T> tree, final PartialOrder<? super T> order) {
        Objects.requireNonNull(item, "item");
        int rank = 0;
        Tree<T> t = tree;
        while (t.getClass() == Tree.Node.class) {
            final Tree.Node<T> n = (Tree.Node<T>) t;
            if (relate(item, n.value, order) == Relation.LESS) {
                t = n.left;
            } else {
                rank += n.left.size() + 1;
                t = n.right;
            }
        }
        return rank;
    }

    /**
     * The k-th smallest value, 1-based.
     *
     * @throws IndexOutOfBoundsException unless {@code 1 <= k <= tree.size()}
     */
    public static <T> T select(int k, final Tree<T> tree) {
        if (k <= 0 || k > tree.size()) {
            throw new IndexOutOfBoundsException("k=" + k + ", size=" + tree.size());
        }
        Tree<T> t = tree;
        while (true) {
            final Tree.Node<T> n = (Tree.Node<T>) t;
            final int leftSize = n.left.size();
            if (k <= leftSize) {
                t = n.left;
            } else if (k == leftSize + 1) {
                return n.value;
            } else {
                k -= leftSize + 1;
                t = n.right;
            }
        }
    }

    private static <T> Relation relate(final T item, final T stored, final PartialOrder<? super T> order) {
        final Relation r = order.relate(item, stored);
        if (r == Relation.INCOMPARABLE) throw new IncomparableValuesException(item, stored);
        return r;
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    /**
     * Verifies the ordering property and the cached size/height of every node.
     *
     * @throws IllegalStateException on the first violation found
     */
    public static <T> void checkInvariants(final Tree<T> tree, final PartialOrder<? super T> order) {
        final ArrayDeque<Frame<T>> pending = new ArrayDeque<>();
        pending.push(new Frame<>(tree, null, null));
        while (!pending.isEmpty()) {
            final Frame<T> frame = pending.pop();
            if (frame.tree.getClass() != Tree.Node.class) continue;
            final Tree.Node<T> n = (Tree.Node<T>) frame.tree;
            final T lo = frame.lo;
            final T hi = frame.hi;

            if (lo != null) {
                final Relation r = order.relate(n.value, lo);
                if (r != Relation.GREATER && r != Relation.EQUAL) {
                    throw new IllegalStateException(n.value + " sits right of " + lo + " but is " + r);
                }
            }
            if (hi != null && order.relate(n.value, hi) != Relation.LESS) {
                throw new IllegalStateException(n.value + " sits left of " + hi + " but is not less");
            }
            if (n.size != 1 + n.left.size() + n.right.size()) {
                throw new IllegalStateException("bad size " + n.size + " at " + n.value);
            }
            if (n.height != 1 + Math.max(n.left.height(), n.right.height())) {
                throw new IllegalStateException("bad height " + n.height + " at " + n.value);
            }
            pending.push(new Frame<>(n.left, lo, n.value));
            pending.push(new Frame<>(n.right, n.value, hi));
        }
    }

    private static final class Frame<T> {
        final Tree<T> tree;
        final T lo;     // inclusive, null = unbounded
        final T hi;     // exclusive, null = unbounded

        Frame(final Tree<T> tree, final T lo, final T hi) {
            this.tree = tree;
            this.lo = lo;
            this.hi = hi;
        }
    }
}
