package bytecalc.ast;

public enum UnaryOperator {
	NEGATE("-");

	private final String symbol;

	UnaryOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
