package ordtree;

import java.util.Objects;

/**
 * Immutable binary search tree value: either {@link Empty} or a {@link Node}.
 * <p>
 * For every node, all values reachable through {@code left} are strictly less than
 * {@code value}, all values reachable through {@code right} are greater than or equal to it.
 * Nodes are never modified once built, so subtrees may be shared between tree versions.
 */
public abstract class Tree<T> {

    // only Empty and Node may extend
    private Tree() {}

    public abstract boolean isEmpty();

    /** Number of values in this tree, duplicates included. */
    public abstract int size();

    /** Number of nodes on the longest root-to-leaf path; 0 for {@link Empty}. */
    public abstract int height();

    @SuppressWarnings("unchecked")
    public static <T> Tree<T> empty() {
        return (Tree<T>) Empty.INSTANCE;
    }

    //--------------------------------------------------------------------------------
    // Variants
    //--------------------------------------------------------------------------------

    public static final class Empty<T> extends Tree<T> {
        static final Empty<Object> INSTANCE = new Empty<>();

        private Empty() {}

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public int size() {
            return 0;
        }

        @Override
        public int height() {
            return 0;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }

    public static final class Node<T> extends Tree<T> {
        final T value;
        final Tree<T> left;
        final Tree<T> right;
        final int size;     // values in this subtree
        final int height;   // longest path, counted in nodes

        Node(final T value, final Tree<T> left, final Tree<T> right) {
            this.value = Objects.requireNonNull(value, "value");
            this.left = left;
            this.right = right;
            this.size = 1 + left.size() + right.size();
            this.height = 1 + Math.max(left.height(), right.height());
        }

        public T value() {
            return value;
        }

        public Tree<T> left() {
            return left;
        }

        public Tree<T> right() {
            return right;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public int height() {
            return height;
        }

        @Override
        public String toString() {
            return "Node(" + value + ", " + left + ", " + right + ")";
        }
    }
}
