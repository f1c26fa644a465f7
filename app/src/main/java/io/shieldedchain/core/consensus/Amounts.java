package io.shieldedchain.core.consensus;

/**
 * Overflow-checked value-pool arithmetic over monetary amounts in minor units.
 * Every accumulation step is range-checked on its own; totals are never summed first and checked later.
 */
public final class Amounts {
    private Amounts() {}

    public static final long COIN = 100_000_000L;
    public static final long MAX_MONEY = 84_000_000L * COIN;

    /** A single amount entering a value pool: {@code 0 <= v <= MAX_MONEY}. */
    public static boolean moneyRange(long v) {
        return v >= 0 && v <= MAX_MONEY;
    }

    /** A signed quantity such as a running total or value balance: {@code -MAX_MONEY <= v <= MAX_MONEY}. */
    public static boolean signedMoneyRange(long v) {
        return v >= -MAX_MONEY && v <= MAX_MONEY;
    }

    /**
     * Adds a pool-entry amount to a running total.
     *
     * @throws AmountRangeException with kind {@code AMOUNT} if {@code amount} is outside
     *         {@code [0, MAX_MONEY]}, or kind {@code TOTAL} if the result leaves
     *         {@code [-MAX_MONEY, MAX_MONEY]} or overflows
     */
    public static long add(long total, long amount) {
        if (!moneyRange(amount)) {
            throw new AmountRangeException(AmountRangeException.Kind.AMOUNT,
                    "amount out of range: " + amount);
        }
        long sum;
        try {
            sum = Math.addExact(total, amount);
        } catch (ArithmeticException e) {
            throw new AmountRangeException(AmountRangeException.Kind.TOTAL,
                    "total overflow: " + total + " + " + amount, e);
        }
        if (!signedMoneyRange(sum)) {
            throw new AmountRangeException(AmountRangeException.Kind.TOTAL,
                    "total out of range: " + sum);
        }
        return sum;
    }

    /** Decimal rendering in whole coins, e.g. {@code 12.5}. */
    public static String format(long amount) {
        return java.math.BigDecimal.valueOf(amount, 8).stripTrailingZeros().toPlainString();
    }
}
