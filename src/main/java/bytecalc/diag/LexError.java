package bytecalc.diag;

import bytecalc.ast.SourceSpan;

import java.util.Objects;

/**
 * A lexical failure at a single byte. {@code detail} is set only for
 * {@link LexErrorKind#INVALID_DIGIT}.
 */
public record LexError(LexErrorKind kind, IntegerError detail, int offset) implements Diagnostic {
	public LexError {
		Objects.requireNonNull(kind, "kind");
		if ((kind == LexErrorKind.INVALID_DIGIT) != (detail != null)) {
			throw new IllegalArgumentException("integer detail does not match kind " + kind);
		}
	}

	public static LexError unexpectedCharacter(int offset) {
		return new LexError(LexErrorKind.UNEXPECTED_CHARACTER, null, offset);
	}

	public static LexError invalidDigit(IntegerError detail, int offset) {
		return new LexError(LexErrorKind.INVALID_DIGIT, detail, offset);
	}

	@Override
	public SourceSpan span() {
		return SourceSpan.at(offset);
	}

	@Override
	public String message() {
		if (kind == LexErrorKind.UNEXPECTED_CHARACTER) {
			return "Unexpected character";
		}
		return "Invalid digit: " + detail.message();
	}
}
