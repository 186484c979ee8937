package bench;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class InsertionOrderBenchTest {

    @Test
    void values_coverEveryOrder() {
        assertEquals(List.of(0, 1, 2, 3), InsertionOrderBench.values(InsertionOrderBench.Order.SORTED, 4, new Random(1)));
        assertEquals(List.of(3, 2, 1, 0), InsertionOrderBench.values(InsertionOrderBench.Order.REVERSED, 4, new Random(1)));
        List<Integer> shuffled = InsertionOrderBench.values(InsertionOrderBench.Order.SHUFFLED, 50, new Random(1));
        assertEquals(50, shuffled.size());
        assertEquals(49 * 50 / 2, shuffled.stream().mapToInt(Integer::intValue).sum());
    }

    @Test
    void main_reportsDegenerateHeightForSortedInput() {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            InsertionOrderBench.main(new String[]{"200", "1", "7"});
        } finally {
            System.setOut(original);
        }
        String out = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("count=200, reps=1, seed=7"), out);
        assertTrue(out.matches("(?s).*SORTED\\s+200\\s.*"), out);
        assertTrue(out.matches("(?s).*REVERSED\\s+200\\s.*"), out);
    }

    @Test
    void main_rejectsNonPositiveArguments() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> InsertionOrderBench.main(new String[]{"10", "0", "1"}));
        assertTrue(e.getMessage().contains("reps"), e.getMessage());

        e = assertThrows(IllegalArgumentException.class,
                () -> InsertionOrderBench.main(new String[]{"0", "1", "1"}));
        assertTrue(e.getMessage().contains("count"), e.getMessage());
    }

    @Test
    void main_labelsBitLengthColumn() {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            InsertionOrderBench.main(new String[]{"8", "1", "3"});
        } finally {
            System.setOut(original);
        }
        String out = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("bits(n)"), out);
        // 8 = 0b1000 has four bits
        assertTrue(out.matches("(?s).*SORTED\\s+8\\s+4\\s.*"), out);
    }
}
