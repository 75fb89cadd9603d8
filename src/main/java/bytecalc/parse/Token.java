package bytecalc.parse;

import bytecalc.ast.SourceSpan;
import bytecalc.unit.FullUnit;
import bytecalc.unit.Unsigned;

import java.util.Objects;

/**
 * A lexed token. {@code integer} is only meaningful for {@link TokenKind#INTEGER} and holds an
 * unsigned 64-bit magnitude; {@code unit} is non-null only for {@link TokenKind#UNIT}.
 */
public record Token(TokenKind kind, long integer, FullUnit unit, SourceSpan span) {
	public Token {
		Objects.requireNonNull(kind, "kind");
		Objects.requireNonNull(span, "span");
		if ((kind == TokenKind.UNIT) != (unit != null)) {
			throw new IllegalArgumentException("unit payload does not match token kind " + kind);
		}
	}

	public static Token of(TokenKind kind, SourceSpan span) {
		return new Token(kind, 0L, null, span);
	}

	public static Token integer(long value, SourceSpan span) {
		return new Token(TokenKind.INTEGER, value, null, span);
	}

	public static Token unit(FullUnit unit, SourceSpan span) {
		return new Token(TokenKind.UNIT, 0L, unit, span);
	}

	public boolean is(TokenKind other) {
		return kind == other;
	}

	/** Source-like rendering used in diagnostics and tree dumps. */
	@Override
	public String toString() {
		switch (kind) {
			case MINUS:
				return "-";
			case PLUS:
				return "+";
			case STAR:
				return "*";
			case SLASH:
				return "/";
			case LEFT_PAREN:
				return "(";
			case RIGHT_PAREN:
				return ")";
			case INTEGER:
				return Unsigned.toString(integer);
			case UNIT:
				return unit.toString();
			case AS:
				return "as";
			case EOF:
				return "<eof>";
			default:
				throw new IllegalStateException("unknown token kind " + kind);
		}
	}
}
