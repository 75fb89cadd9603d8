package bytecalc.ast;

import bytecalc.parse.TokenKind;

public enum BinaryOperator {
	ADD("+"),
	SUBTRACT("-"),
	MULTIPLY("*"),
	DIVIDE("/");

	private final String symbol;

	BinaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	/**
	 * @throws IllegalArgumentException if {@code kind} is not a binary operator token
	 */
	public static BinaryOperator fromToken(TokenKind kind) {
		switch (kind) {
			case PLUS:
				return ADD;
			case MINUS:
				return SUBTRACT;
			case STAR:
				return MULTIPLY;
			case SLASH:
				return DIVIDE;
			default:
				throw new IllegalArgumentException("not a binary operator: " + kind);
		}
	}
}
