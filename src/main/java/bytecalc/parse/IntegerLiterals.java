package bytecalc.parse;

import bytecalc.diag.IntegerError;

/**
 * Converts runs of digits into unsigned 64-bit magnitudes.
 *
 * One routine serves every radix: it scans the maximal run of digits valid for the radix and
 * accumulates {@code value * radix + digit}, checking for overflow unless the run is too short
 * to overflow.
 */
public final class IntegerLiterals {
	/** Longest run that cannot overflow 64 bits for any radix up to 16. */
	private static final int SAFE_DIGITS = Long.BYTES * 2;

	private IntegerLiterals() {
	}

	public enum Radix {
		BINARY(2),
		OCTAL(8),
		DECIMAL(10),
		HEX(16);

		private final int base;

		Radix(int base) {
			this.base = base;
		}

		public int base() {
			return base;
		}

		/** Digit value of {@code c} in this radix, or -1 if it is not a digit here. */
		int digit(int c) {
			int value;
			if (c >= '0' && c <= '9') {
				value = c - '0';
			} else if (c >= 'a' && c <= 'f') {
				value = c - 'a' + 10;
			} else if (c >= 'A' && c <= 'F') {
				value = c - 'A' + 10;
			} else {
				return -1;
			}
			return value < base ? value : -1;
		}

		/** Maps the letter after a leading {@code 0} to its radix, or null. */
		static Radix fromPrefixLetter(int c) {
			switch (c) {
				case 'b':
					return BINARY;
				case 'o':
					return OCTAL;
				case 'x':
					return HEX;
				default:
					return null;
			}
		}
	}

	/** Result of a successful scan: the magnitude and the offset just past the last digit. */
	public record Scan(long value, int end) {
	}

	/** Raised for an unconvertible digit run; {@link IntegerError#EMPTY} etc. */
	public static final class IntegerFormatException extends RuntimeException {
		private final IntegerError error;

		IntegerFormatException(IntegerError error) {
			super(error.message());
			this.error = error;
		}

		public IntegerError error() {
			return error;
		}
	}

	/**
	 * Scans digits of {@code radix} in {@code source} from {@code start}.
	 *
	 * @param prefixed whether a radix prefix preceded {@code start}; a binary or octal run
	 *                 stopped by a decimal digit is then rejected with
	 *                 {@link IntegerError.InvalidDigitAt}
	 * @throws IntegerFormatException if there are no digits, a bad digit follows a prefixed
	 *                                run, or the value exceeds 64 bits
	 */
	public static Scan scan(byte[] source, int start, Radix radix, boolean prefixed) {
		int end = start;
		while (end < source.length && radix.digit(source[end]) >= 0) {
			end++;
		}
		int count = end - start;
		if (count == 0) {
			throw new IntegerFormatException(IntegerError.EMPTY);
		}
		if (prefixed && end < source.length && isDecimalDigit(source[end])) {
			throw new IntegerFormatException(new IntegerError.InvalidDigitAt(count));
		}

		long base = radix.base();
		long value = 0;
		if (count <= SAFE_DIGITS) {
			for (int i = start; i < end; i++) {
				value = value * base + radix.digit(source[i]);
			}
		} else {
			for (int i = start; i < end; i++) {
				int digit = radix.digit(source[i]);
				// value * base + digit must stay <= 2^64 - 1
				long limit = Long.divideUnsigned(-1L - digit, base);
				if (Long.compareUnsigned(value, limit) > 0) {
					throw new IntegerFormatException(IntegerError.OVERFLOW);
				}
				value = value * base + digit;
			}
		}
		return new Scan(value, end);
	}

	private static boolean isDecimalDigit(byte c) {
		return c >= '0' && c <= '9';
	}
}
