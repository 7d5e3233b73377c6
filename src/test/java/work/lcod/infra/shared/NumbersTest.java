package work.lcod.infra.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {
    @Test
    void onlyNarrowsWhenTheValueFitsALong() {
        assertTrue(Numbers.fitsLong(-9.223372036854775808E18));
        assertFalse(Numbers.fitsLong(9.223372036854775808E18));
        assertFalse(Numbers.fitsLong(2.5));
        assertTrue(Numbers.fitsLong(Long.MAX_VALUE));
        assertTrue(Numbers.isIntegral(1e300));
        assertFalse(Numbers.isIntegral(Double.NaN));
    }

    @Test
    void formatsIntegralValuesWithoutAFraction() {
        assertEquals("42", Numbers.format(42.0));
        assertEquals("42", Numbers.format(42));
        assertEquals("0.1", Numbers.format(0.1));
        assertEquals("10000000000000000000", Numbers.format(1e19));
        assertEquals("Infinity", Numbers.format(Double.POSITIVE_INFINITY));
    }
}
