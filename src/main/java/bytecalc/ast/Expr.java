package bytecalc.ast;

import bytecalc.parse.Token;
import bytecalc.parse.TokenKind;

import java.util.Objects;

/**
 * Expression tree produced by {@link bytecalc.parse.Parser}. Immutable.
 */
public sealed interface Expr permits Expr.Literal, Expr.Grouping, Expr.Operator {
	SourceSpan span();

	/** An integer literal with an optional unit suffix; {@code unit} may be null. */
	record Literal(Token integer, Token unit) implements Expr {
		public Literal {
			Objects.requireNonNull(integer, "integer");
			if (integer.kind() != TokenKind.INTEGER) {
				throw new IllegalArgumentException("literal must start with an integer token: " + integer);
			}
			if (unit != null && unit.kind() != TokenKind.UNIT) {
				throw new IllegalArgumentException("literal suffix must be a unit token: " + unit);
			}
		}

		public boolean hasUnit() {
			return unit != null;
		}

		@Override
		public SourceSpan span() {
			return unit == null ? integer.span() : integer.span().to(unit.span());
		}
	}

	/** A parenthesised expression; {@code span} covers both parentheses. */
	record Grouping(Expr expression, SourceSpan span) implements Expr {
	}

	/** Nodes that keep their operator token for dispatch and diagnostics. */
	sealed interface Operator extends Expr permits Binary, TypeCast, Unary {
		Token operatorToken();
	}

	record Binary(Expr left, BinaryOperator operator, Token operatorToken, Expr right) implements Operator {
		@Override
		public SourceSpan span() {
			return left.span().to(right.span());
		}
	}

	record TypeCast(Expr left, Token operatorToken, Token unit) implements Operator {
		public TypeCast {
			if (unit.kind() != TokenKind.UNIT) {
				throw new IllegalArgumentException("cast target must be a unit token: " + unit);
			}
		}

		@Override
		public SourceSpan span() {
			return left.span().to(unit.span());
		}
	}

	record Unary(UnaryOperator operator, Token operatorToken, Expr right) implements Operator {
		@Override
		public SourceSpan span() {
			return operatorToken.span().to(right.span());
		}
	}
}
