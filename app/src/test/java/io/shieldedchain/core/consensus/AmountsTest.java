package io.shieldedchain.core.consensus;

import org.junit.jupiter.api.Test;

import static io.shieldedchain.core.consensus.Amounts.MAX_MONEY;
import static org.junit.jupiter.api.Assertions.*;

class AmountsTest {

    @Test
    void addFromZeroUpToMaxMoneySucceeds() {
        assertEquals(MAX_MONEY, Amounts.add(0, MAX_MONEY));
    }

    @Test
    void addPastMaxMoneyIsATotalError() {
        for (long amount : new long[]{1, 1_000, MAX_MONEY}) {
            AmountRangeException e = assertThrows(AmountRangeException.class, () -> Amounts.add(MAX_MONEY, amount));
            assertEquals(AmountRangeException.Kind.TOTAL, e.kind());
        }
    }

    @Test
    void amountOutsideMoneyRangeIsAnAmountError() {
        AmountRangeException tooBig = assertThrows(AmountRangeException.class, () -> Amounts.add(0, MAX_MONEY + 1));
        assertEquals(AmountRangeException.Kind.AMOUNT, tooBig.kind());
        AmountRangeException negative = assertThrows(AmountRangeException.class, () -> Amounts.add(0, -1));
        assertEquals(AmountRangeException.Kind.AMOUNT, negative.kind());
    }

    @Test
    void hugeRunningTotalOverflowIsReportedNotWrapped() {
        AmountRangeException e = assertThrows(AmountRangeException.class, () -> Amounts.add(Long.MAX_VALUE, 1));
        assertEquals(AmountRangeException.Kind.TOTAL, e.kind());
    }

    @Test
    void negativeTotalsAreAllowedWithinSignedRange() {
        assertEquals(-MAX_MONEY + 5, Amounts.add(-MAX_MONEY, 5));
    }

    @Test
    void rangePredicates() {
        assertTrue(Amounts.moneyRange(0));
        assertTrue(Amounts.moneyRange(MAX_MONEY));
        assertFalse(Amounts.moneyRange(-1));
        assertFalse(Amounts.moneyRange(MAX_MONEY + 1));
        assertTrue(Amounts.signedMoneyRange(-MAX_MONEY));
        assertFalse(Amounts.signedMoneyRange(-MAX_MONEY - 1));
    }

    @Test
    void formatsWholeCoins() {
        assertEquals("12.5", Amounts.format(1_250_000_000L));
        assertEquals("0.00000001", Amounts.format(1));
    }
}
