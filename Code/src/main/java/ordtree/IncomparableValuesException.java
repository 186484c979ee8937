package ordtree;

/**
 * Thrown when the tree's ordering cannot relate a value to a value already stored.
 * The tree the operation was invoked on is left as it was.
 * <p>
 * The two values are not serialized: on a deserialized copy {@link #item()} and
 * {@link #existing()} return {@code null}, and only the message survives.
 */
public class IncomparableValuesException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient Object item;
    private final transient Object existing;

    public IncomparableValuesException(final Object item, final Object existing) {
        super("Cannot order " + item + " relative to " + existing);
        this.item = item;
        this.existing = existing;
    }

    /** The value being inserted or looked up; {@code null} after deserialization. */
    public Object item() {
        return item;
    }

    /** The stored value it could not be related to; {@code null} after deserialization. */
    public Object existing() {
        return existing;
    }
}
