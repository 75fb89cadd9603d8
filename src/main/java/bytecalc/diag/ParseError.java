package bytecalc.diag;

import bytecalc.ast.SourceSpan;
import bytecalc.parse.Parser;
import bytecalc.parse.Token;

import java.util.Objects;

/**
 * A syntactic failure located at the token that was found instead.
 * {@code expected} describes the missing token and is set only for
 * {@link ParseErrorKind#UNEXPECTED_TOKEN}.
 */
public record ParseError(ParseErrorKind kind, String expected, Token found) implements Diagnostic {
	public ParseError {
		Objects.requireNonNull(kind, "kind");
		Objects.requireNonNull(found, "found");
		if ((kind == ParseErrorKind.UNEXPECTED_TOKEN) != (expected != null)) {
			throw new IllegalArgumentException("expected description does not match kind " + kind);
		}
	}

	public static ParseError unexpectedToken(String expected, Token found) {
		return new ParseError(ParseErrorKind.UNEXPECTED_TOKEN, expected, found);
	}

	public static ParseError of(ParseErrorKind kind, Token found) {
		return new ParseError(kind, null, found);
	}

	@Override
	public SourceSpan span() {
		return found.span();
	}

	@Override
	public String message() {
		switch (kind) {
			case UNEXPECTED_TOKEN:
				return "Unexpected token '" + found + "', expected " + expected;
			case EXPECTED_EXPRESSION:
				return "Expected expression, found '" + found + "'";
			case EXPECTED_EOF:
				return "Expected end of expression, found '" + found + "'";
			case EXPECTED_UNIT:
				return "Expected unit after 'as', found '" + found + "'";
			case NESTING_TOO_DEEP:
				return "Nesting limit of " + Parser.MAX_DEPTH + " exceeded at '" + found + "'";
			default:
				throw new IllegalStateException("unknown parse error kind " + kind);
		}
	}
}
