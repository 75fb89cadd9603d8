package bytecalc.unit;

/**
 * Helpers for {@code long} values that carry an unsigned 64-bit magnitude.
 */
public final class Unsigned {
	private static final double TWO_POW_63 = 0x1p63;
	private static final double TWO_POW_64 = 0x1p64;

	private Unsigned() {
	}

	public static double toDouble(long value) {
		if (value >= 0) {
			return (double) value;
		}
		// halve, keeping the low bit for correct rounding, then double
		double half = (double) ((value >>> 1) | (value & 1L));
		return half * 2.0;
	}

	/**
	 * Truncates a non-negative finite {@code double} below 2^64 to its unsigned 64-bit magnitude.
	 *
	 * @throws IllegalArgumentException if {@code value} is negative, not finite or too large
	 */
	public static long fromDouble(double value) {
		if (!(value >= 0.0) || value >= TWO_POW_64) {
			throw new IllegalArgumentException("not an unsigned 64-bit magnitude: " + value);
		}
		if (value < TWO_POW_63) {
			return (long) value;
		}
		return (long) (value - TWO_POW_63) + Long.MIN_VALUE;
	}

	public static String toString(long value) {
		return Long.toUnsignedString(value);
	}
}
