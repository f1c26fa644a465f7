package io.shieldedchain.core.consensus;

/**
 * Raised by {@link Amounts#add(long, long)}. The kind tells a single out-of-range amount apart
 * from a running total that left the allowed range, since each maps to its own rejection reason.
 */
public final class AmountRangeException extends IllegalArgumentException {

    public enum Kind { AMOUNT, TOTAL }

    private final Kind kind;

    public AmountRangeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AmountRangeException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
