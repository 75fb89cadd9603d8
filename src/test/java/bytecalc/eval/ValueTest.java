package bytecalc.eval;

import bytecalc.diag.ValueErrorKind;
import bytecalc.unit.FullUnit;
import bytecalc.unit.Unit;
import bytecalc.unit.UnitPrefix;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ValueTest {
	private static final FullUnit KB = FullUnit.of(UnitPrefix.KILO, Unit.BYTE);
	private static final FullUnit MB = FullUnit.of(UnitPrefix.MEGA, Unit.BYTE);
	private static final FullUnit KIB = FullUnit.of(UnitPrefix.KIBI, Unit.BYTE);
	private static final FullUnit MIB = FullUnit.of(UnitPrefix.MEBI, Unit.BYTE);

	@Test
	void convertRescalesBetweenUnits() {
		Value converted = Value.of(42, KB).convertTo(MB);
		assertEquals(0.042, converted.magnitude(), 1e-12);
		assertEquals(MB, converted.unit());

		assertEquals(Value.of(1024, FullUnit.BYTE), Value.of(1, KIB).convertTo(FullUnit.BYTE));
		assertEquals(Value.of(8, FullUnit.BIT), Value.of(1, FullUnit.BYTE).convertTo(FullUnit.BIT));
	}

	@Test
	void convertAttachesUnitToDimensionlessValue() {
		assertEquals(Value.of(42, MB), Value.of(42).convertTo(MB));
	}

	@Test
	void convertToSameUnitReturnsSameValue() {
		Value value = Value.of(3, KIB);
		assertSame(value, value.convertTo(KIB));
	}

	@Test
	void convertIsInvertibleForEveryPairOfUnits() {
		List<FullUnit> units = new ArrayList<>();
		for (UnitPrefix prefix : UnitPrefix.values()) {
			for (Unit unit : Unit.values()) {
				units.add(FullUnit.of(prefix, unit));
			}
		}
		for (FullUnit a : units) {
			for (FullUnit b : units) {
				Value start = Value.of(1234.5, a);
				Value back = start.convertTo(b).convertTo(a);
				assertEquals(a, back.unit());
				assertEquals(start.magnitude(), back.magnitude(), 1234.5 * 1e-9, a + " -> " + b);
			}
		}
	}

	@Test
	void addingSameUnitsCombinesMagnitudes() {
		assertEquals(Value.of(3), Value.of(1).add(Value.of(2)));
		assertEquals(Value.of(5, KIB), Value.of(2, KIB).add(Value.of(3, KIB)));
		assertEquals(Value.of(-1, KIB), Value.of(2, KIB).subtract(Value.of(3, KIB)));
	}

	@Test
	void dimensionlessOperandTakesTheOtherUnitWithoutConversion() {
		assertEquals(Value.of(3, KIB), Value.of(1).add(Value.of(2, KIB)));
		assertEquals(Value.of(3, KIB), Value.of(2, KIB).add(Value.of(1)));
		assertEquals(Value.of(3, KIB), Value.of(5, KIB).subtract(Value.of(2)));
		assertEquals(Value.of(-3, KIB), Value.of(2).subtract(Value.of(5, KIB)));
	}

	@Test
	void mixedUnitsCombineInTheMorePreciseUnit() {
		assertEquals(Value.of(3075, KIB), Value.of(3, KIB).add(Value.of(3, MIB)));
		assertEquals(Value.of(999, FullUnit.BYTE), Value.of(1, KB).subtract(Value.of(1, FullUnit.BYTE)));

		Value sum = Value.of(1, KIB).add(Value.of(1, KB));
		assertEquals(KB, sum.unit());
		assertEquals(2.024, sum.magnitude(), 1e-12);
	}

	@Test
	void multiplicationFailsOnlyWhenBothSidesHaveUnits() {
		assertEquals(Value.of(84, KB), Value.of(42, KB).tryMultiply(Value.of(2)));
		assertEquals(Value.of(84, MB), Value.of(42).tryMultiply(Value.of(2, MB)));
		assertEquals(Value.of(84), Value.of(42).tryMultiply(Value.of(2)));
		ValueException e = assertThrows(ValueException.class, () -> Value.of(1, KIB).tryMultiply(Value.of(2, KIB)));
		assertEquals(ValueErrorKind.MULTIPLICATION_BY_UNIT, e.kind());
	}

	@Test
	void divisionFailsOnlyWhenTheDivisorHasAUnit() {
		assertEquals(Value.of(21, KB), Value.of(42, KB).tryDivide(Value.of(2)));
		assertEquals(Value.of(2.5), Value.of(10).tryDivide(Value.of(4)));
		assertEquals(ValueErrorKind.DIVISION_BY_UNIT,
				assertThrows(ValueException.class, () -> Value.of(42).tryDivide(Value.of(2, KB))).kind());
		assertEquals(ValueErrorKind.DIVISION_BY_UNIT,
				assertThrows(ValueException.class, () -> Value.of(42, KB).tryDivide(Value.of(2, KB))).kind());
	}

	@Test
	void divisionByZeroIsNotAnError() {
		assertEquals(Double.POSITIVE_INFINITY, Value.of(1, KIB).tryDivide(Value.of(0)).magnitude());
		assertEquals(Double.NaN, Value.of(0).tryDivide(Value.of(0)).magnitude());
	}

	@Test
	void negationKeepsUnit() {
		assertEquals(Value.of(-3, KIB), Value.of(3, KIB).negate());
		assertNull(Value.of(3).negate().unit());
	}

	@Test
	void rendersMagnitudeWithoutTrailingZero() {
		assertEquals("3075KiB", Value.of(3075, KIB).toString());
		assertEquals("42kB", Value.of(42, KB).toString());
		assertEquals("42", Value.of(42).toString());
		assertEquals("-1234", Value.of(-1234).toString());
		assertEquals("0.5MiB", Value.of(0.5, MIB).toString());
		assertEquals("100000000000000000000", Value.of(1e20).toString());
		assertEquals("0", Value.of(-0.0).toString());
		assertEquals("Infinity", Value.of(Double.POSITIVE_INFINITY).toString());
		assertEquals("NaN", Value.of(Double.NaN).toString());
	}
}
