package bytecalc.diag;

public enum ValueErrorKind {
	DIVISION_BY_UNIT("Cannot divide by a value with a unit"),
	MULTIPLICATION_BY_UNIT("Cannot multiply two values with units");

	private final String message;

	ValueErrorKind(String message) {
		this.message = message;
	}

	public String message() {
		return message;
	}
}
