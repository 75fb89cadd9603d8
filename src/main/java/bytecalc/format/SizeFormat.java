package bytecalc.format;

import bytecalc.unit.Unsigned;
import bytecalc.unit.UnitPrefix;

import java.util.Locale;

/**
 * Human-readable renderings of an unsigned 64-bit byte count.
 */
public final class SizeFormat {
	private static final int GROUP = 8;

	private SizeFormat() {
	}

	/**
	 * Binary digits in groups of eight, zero-padded on the left to whole groups:
	 * {@code 256 -> "00000001 00000000"}.
	 */
	public static String binaryGroups(long magnitude) {
		String bits = Long.toBinaryString(magnitude);
		int pad = (GROUP - bits.length() % GROUP) % GROUP;
		String padded = "0".repeat(pad) + bits;

		StringBuilder out = new StringBuilder(padded.length() + padded.length() / GROUP);
		for (int i = 0; i < padded.length(); i += GROUP) {
			if (i > 0) {
				out.append(' ');
			}
			out.append(padded, i, i + GROUP);
		}
		return out.toString();
	}

	/** Scaled by the largest fitting decimal prefix: {@code 1500000 -> "1.5 MB"}. */
	public static String decimalSize(long magnitude) {
		return scaled(magnitude, UnitPrefix.decimalFor(magnitude));
	}

	/** Scaled by the largest fitting binary prefix: {@code 1536 -> "1.5 KiB"}. */
	public static String binarySize(long magnitude) {
		return scaled(magnitude, UnitPrefix.binaryFor(magnitude));
	}

	private static String scaled(long magnitude, UnitPrefix prefix) {
		double value = Unsigned.toDouble(magnitude) / Unsigned.toDouble(prefix.multiplier());
		// exact multiples print without a fraction digit
		int digits = Long.remainderUnsigned(magnitude, prefix.multiplier()) == 0 ? 0 : 1;
		return String.format(Locale.ROOT, "%." + digits + "f %sB", value, prefix.symbol());
	}
}
