package bytecalc.eval;

import bytecalc.diag.ValueErrorKind;

/**
 * Exception thrown when the unit algebra rejects an operation. Carries no location; the
 * evaluator attaches the operator token.
 */
public class ValueException extends RuntimeException {
	private final ValueErrorKind kind;

	public ValueException(ValueErrorKind kind) {
		super(kind.message());
		this.kind = kind;
	}

	public ValueErrorKind kind() {
		return kind;
	}
}
