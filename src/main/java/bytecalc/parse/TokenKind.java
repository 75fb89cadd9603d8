package bytecalc.parse;

public enum TokenKind {
	// single character
	MINUS,
	PLUS,
	STAR,
	SLASH,
	LEFT_PAREN,
	RIGHT_PAREN,

	// literals
	INTEGER,
	UNIT,

	// keywords
	AS,

	EOF
}
