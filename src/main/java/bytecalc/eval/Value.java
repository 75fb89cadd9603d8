package bytecalc.eval;

import bytecalc.diag.ValueErrorKind;
import bytecalc.unit.FullUnit;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/**
 * A magnitude with an optional unit. A null {@code unit} means dimensionless, not unknown.
 */
public record Value(double magnitude, FullUnit unit) {

	public static Value of(double magnitude) {
		return new Value(magnitude, null);
	}

	public static Value of(double magnitude, FullUnit unit) {
		return new Value(magnitude, unit);
	}

	public boolean hasUnit() {
		return unit != null;
	}

	/**
	 * Expresses this value in {@code target}. A dimensionless value is taken to already be in
	 * {@code target}, so only the unit is attached.
	 */
	public Value convertTo(FullUnit target) {
		if (target.equals(unit)) {
			return this;
		}
		if (unit == null) {
			return new Value(magnitude, target);
		}
		double factor = unit.totalMultiplierAsDouble() / target.totalMultiplierAsDouble();
		return new Value(magnitude * factor, target);
	}

	public Value add(Value rhs) {
		return combine(rhs, Double::sum);
	}

	public Value subtract(Value rhs) {
		return combine(rhs, (a, b) -> a - b);
	}

	/**
	 * Same units combine directly. If only one side has a unit the raw magnitudes combine and the
	 * result takes that unit. Otherwise both sides convert to the more precise unit first.
	 */
	private Value combine(Value rhs, DoubleBinaryOperator op) {
		if (Objects.equals(unit, rhs.unit)) {
			return new Value(op.applyAsDouble(magnitude, rhs.magnitude), unit);
		}
		if (unit == null || rhs.unit == null) {
			FullUnit result = unit != null ? unit : rhs.unit;
			return new Value(op.applyAsDouble(magnitude, rhs.magnitude), result);
		}
		FullUnit precise = FullUnit.min(unit, rhs.unit);
		double left = convertTo(precise).magnitude;
		double right = rhs.convertTo(precise).magnitude;
		return new Value(op.applyAsDouble(left, right), precise);
	}

	/**
	 * @throws ValueException with {@link ValueErrorKind#MULTIPLICATION_BY_UNIT} if both sides
	 *                        carry a unit
	 */
	public Value tryMultiply(Value rhs) {
		if (unit != null && rhs.unit != null) {
			throw new ValueException(ValueErrorKind.MULTIPLICATION_BY_UNIT);
		}
		return new Value(magnitude * rhs.magnitude, unit != null ? unit : rhs.unit);
	}

	/**
	 * @throws ValueException with {@link ValueErrorKind#DIVISION_BY_UNIT} if the divisor
	 *                        carries a unit
	 */
	public Value tryDivide(Value rhs) {
		if (rhs.unit != null) {
			throw new ValueException(ValueErrorKind.DIVISION_BY_UNIT);
		}
		return new Value(magnitude / rhs.magnitude, unit);
	}

	public Value negate() {
		return new Value(-magnitude, unit);
	}

	/** Magnitude in plain notation without a trailing {@code .0}, e.g. {@code 3075KiB}. */
	@Override
	public String toString() {
		String text = formatMagnitude(magnitude);
		return unit == null ? text : text + unit;
	}

	static String formatMagnitude(double magnitude) {
		if (Double.isNaN(magnitude) || Double.isInfinite(magnitude)) {
			return Double.toString(magnitude);
		}
		if (magnitude == 0.0) {
			return "0";
		}
		return new BigDecimal(Double.toString(magnitude)).stripTrailingZeros().toPlainString();
	}
}
