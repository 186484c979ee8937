package bench;

import ordtree.OrderedTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shows how insertion order drives tree shape: sorted input degenerates into a list,
 * shuffled input stays logarithmic. Traversal output is the same in every case.
 *
 * Usage: InsertionOrderBench [count] [reps] [seed]
 */
public class InsertionOrderBench {

    enum Order { SORTED, REVERSED, SHUFFLED }

    public static void main(String[] args) {
        int count = (args.length >= 1) ? Integer.parseInt(args[0]) : 10_000;
        int reps  = (args.length >= 2) ? Integer.parseInt(args[1]) : 5;
        long seed = (args.length >= 3) ? Long.parseLong(args[2]) : 42L;
        if (count < 1) throw new IllegalArgumentException("count must be at least 1, got " + count);
        if (reps < 1) throw new IllegalArgumentException("reps must be at least 1, got " + reps);

        System.out.printf("count=%d, reps=%d, seed=%d%n", count, reps, seed);
        System.out.printf("%-10s %8s %8s %14s %14s%n", "order", "height", "bits(n)", "insert ms", "traverse ms");

        List<Integer> reference = null;
        for (Order order : Order.values()) {
            List<Integer> input = values(order, count, new Random(seed));

            long insertNanos = 0, traverseNanos = 0;
            OrderedTree<Integer> tree = null;
            List<Integer> out = null;
            for (int r = 0; r < reps; r++) {
                long t0 = System.nanoTime();
                tree = OrderedTree.<Integer>empty().insertAll(input);
                long t1 = System.nanoTime();
                out = tree.traverse();
                long t2 = System.nanoTime();
                insertNanos += t1 - t0;
                traverseNanos += t2 - t1;
            }

            if (reference == null) reference = out;
            else if (!reference.equals(out)) {
                System.err.printf("Traversal for %s differs from %s%n", order, Order.SORTED);
            }

            System.out.printf("%-10s %8d %8d %14.2f %14.2f%n",
                    order, tree.height(), 32 - Integer.numberOfLeadingZeros(count),
                    insertNanos / (double) reps / 1_000_000.0,
                    traverseNanos / (double) reps / 1_000_000.0);
        }
    }

    static List<Integer> values(Order order, int count, Random rnd) {
        List<Integer> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) values.add(i);
        switch (order) {
            case REVERSED:
                Collections.reverse(values);
                break;
            case SHUFFLED:
                Collections.shuffle(values, rnd);
                break;
            default:
                break;
        }
        return values;
    }
}
