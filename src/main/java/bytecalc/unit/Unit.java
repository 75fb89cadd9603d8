package bytecalc.unit;

/**
 * Base unit of digital storage. Declaration order is size order.
 */
public enum Unit {
	BIT(1, "b"),
	BYTE(8, "B");

	private final int size;
	private final String symbol;

	Unit(int size, String symbol) {
		this.size = size;
		this.symbol = symbol;
	}

	/** Size in bits. */
	public int size() {
		return size;
	}

	public String symbol() {
		return symbol;
	}

	@Override
	public String toString() {
		return symbol;
	}
}
