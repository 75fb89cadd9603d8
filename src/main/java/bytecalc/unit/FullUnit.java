package bytecalc.unit;

import java.util.Objects;

/**
 * A concrete unit of digital storage, e.g. {@code KiB} or {@code Mb}.
 *
 * Ordering compares total multipliers; equality compares prefix and unit.
 */
public record FullUnit(UnitPrefix prefix, Unit unit) implements Comparable<FullUnit> {
	public static final FullUnit BIT = new FullUnit(UnitPrefix.NONE, Unit.BIT);
	public static final FullUnit BYTE = new FullUnit(UnitPrefix.NONE, Unit.BYTE);

	public FullUnit {
		Objects.requireNonNull(prefix, "prefix");
		Objects.requireNonNull(unit, "unit");
	}

	public static FullUnit of(UnitPrefix prefix, Unit unit) {
		return new FullUnit(prefix, unit);
	}

	/**
	 * Prefix multiplier times unit size, in bits. Unsigned: {@code EiB} is 2^63.
	 */
	public long totalMultiplier() {
		return prefix.multiplier() * unit.size();
	}

	public double totalMultiplierAsDouble() {
		return Unsigned.toDouble(totalMultiplier());
	}

	/** The more precise (smaller multiplier) of the two units; {@code a} on a tie. */
	public static FullUnit min(FullUnit a, FullUnit b) {
		return b.compareTo(a) < 0 ? b : a;
	}

	@Override
	public int compareTo(FullUnit other) {
		return Long.compareUnsigned(totalMultiplier(), other.totalMultiplier());
	}

	@Override
	public String toString() {
		return prefix.symbol() + unit.symbol();
	}
}
