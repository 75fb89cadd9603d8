package bytecalc.unit;

/**
 * Decimal (1000^n) and binary (1024^n) scaling prefixes, plus {@link #NONE}.
 */
public enum UnitPrefix {
	NONE("", 1L),
	KILO("k", 1_000L),
	MEGA("M", 1_000_000L),
	GIGA("G", 1_000_000_000L),
	TERA("T", 1_000_000_000_000L),
	PETA("P", 1_000_000_000_000_000L),
	EXA("E", 1_000_000_000_000_000_000L),
	KIBI("Ki", 1L << 10),
	MEBI("Mi", 1L << 20),
	GIBI("Gi", 1L << 30),
	TEBI("Ti", 1L << 40),
	PEBI("Pi", 1L << 50),
	EXBI("Ei", 1L << 60);

	private static final UnitPrefix[] DECIMAL = { NONE, KILO, MEGA, GIGA, TERA, PETA, EXA };
	private static final UnitPrefix[] BINARY = { NONE, KIBI, MEBI, GIBI, TEBI, PEBI, EXBI };

	private final String symbol;
	private final long multiplier;

	UnitPrefix(String symbol, long multiplier) {
		this.symbol = symbol;
		this.multiplier = multiplier;
	}

	public String symbol() {
		return symbol;
	}

	public long multiplier() {
		return multiplier;
	}

	/**
	 * Maps a decimal prefix letter ({@code k m g t p e}, any case) to its prefix.
	 * With {@code binary} set the matching 1024-based prefix is returned instead.
	 *
	 * @return the prefix, or {@code null} if {@code letter} is not a prefix letter
	 */
	public static UnitPrefix fromLetter(char letter, boolean binary) {
		int power;
		switch (Character.toLowerCase(letter)) {
			case 'k':
				power = 1;
				break;
			case 'm':
				power = 2;
				break;
			case 'g':
				power = 3;
				break;
			case 't':
				power = 4;
				break;
			case 'p':
				power = 5;
				break;
			case 'e':
				power = 6;
				break;
			default:
				return null;
		}
		return binary ? BINARY[power] : DECIMAL[power];
	}

	/** Largest decimal prefix whose multiplier does not exceed the unsigned {@code magnitude}. */
	public static UnitPrefix decimalFor(long magnitude) {
		return largestFitting(DECIMAL, magnitude);
	}

	/** Largest binary prefix whose multiplier does not exceed the unsigned {@code magnitude}. */
	public static UnitPrefix binaryFor(long magnitude) {
		return largestFitting(BINARY, magnitude);
	}

	private static UnitPrefix largestFitting(UnitPrefix[] scale, long magnitude) {
		UnitPrefix result = NONE;
		for (UnitPrefix prefix : scale) {
			if (Long.compareUnsigned(prefix.multiplier, magnitude) <= 0) {
				result = prefix;
			}
		}
		return result;
	}

	@Override
	public String toString() {
		return symbol;
	}
}
