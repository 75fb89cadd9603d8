package bytecalc.diag;

public enum LexErrorKind {
	UNEXPECTED_CHARACTER,
	INVALID_DIGIT
}
