package ordtree;

/**
 * Outcome of relating two values under a {@link PartialOrder}.
 */
public enum Relation {
    LESS,
    EQUAL,
    GREATER,
    INCOMPARABLE;

    /** Maps a {@code compareTo}-style result onto a relation. Never yields {@link #INCOMPARABLE}. */
    public static Relation of(final int cmp) {
        if (cmp < 0) return LESS;
        return (cmp == 0) ? EQUAL : GREATER;
    }
}
