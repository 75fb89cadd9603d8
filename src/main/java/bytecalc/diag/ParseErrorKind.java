package bytecalc.diag;

public enum ParseErrorKind {
	UNEXPECTED_TOKEN,
	EXPECTED_EXPRESSION,
	EXPECTED_EOF,
	EXPECTED_UNIT,
	NESTING_TOO_DEEP
}
