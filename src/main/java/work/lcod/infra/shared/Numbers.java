package work.lcod.infra.shared;

import java.math.BigDecimal;

/**
 * Template numbers are doubles. Integral values print without a fraction, and only narrow to
 * {@code long} when they fit.
 */
public final class Numbers {
    private static final double LONG_LIMIT = 0x1p63;

    private Numbers() {}

    public static boolean isIntegral(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    public static boolean fitsLong(double value) {
        return isIntegral(value) && value >= -LONG_LIMIT && value < LONG_LIMIT;
    }

    public static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Long) {
            return true;
        }
        return isIntegral(number.doubleValue());
    }

    public static boolean fitsLong(Number number) {
        if (number instanceof Integer || number instanceof Long) {
            return true;
        }
        return fitsLong(number.doubleValue());
    }

    public static String format(Number number) {
        if (number instanceof Integer || number instanceof Long) {
            return number.toString();
        }
        double value = number.doubleValue();
        if (fitsLong(value)) {
            return Long.toString((long) value);
        }
        if (isIntegral(value)) {
            return BigDecimal.valueOf(value).toBigInteger().toString();
        }
        return Double.toString(value);
    }
}
