package bytecalc.diag;

/**
 * Why an integer literal's digit run could not be converted.
 */
public sealed interface IntegerError permits IntegerError.Empty, IntegerError.InvalidDigitAt, IntegerError.Overflow {
	IntegerError EMPTY = new Empty();
	IntegerError OVERFLOW = new Overflow();

	String message();

	/** No digits followed the radix prefix. */
	record Empty() implements IntegerError {
		@Override
		public String message() {
			return "The input string was empty.";
		}
	}

	/** {@code index} is the position of the bad digit within the digit run. */
	record InvalidDigitAt(int index) implements IntegerError {
		@Override
		public String message() {
			return "The input contained an invalid digit at index " + index + ".";
		}
	}

	record Overflow() implements IntegerError {
		@Override
		public String message() {
			return "The input was too large to fit in the target integer type.";
		}
	}
}
