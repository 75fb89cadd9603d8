package bytecalc.parse;

import bytecalc.ast.BinaryOperator;
import bytecalc.ast.Expr;
import bytecalc.ast.UnaryOperator;
import bytecalc.diag.DiagnosticException;
import bytecalc.diag.ParseError;
import bytecalc.diag.ParseErrorKind;

/**
 * Recursive-descent parser with a single token of lookahead over a {@link Lexer}.
 *
 * <pre>
 * expression -> term EOF
 * term       -> factor ( ( "+" | "-" ) factor )*
 * factor     -> typecast ( ( "*" | "/" ) typecast )*
 * typecast   -> unary ( "as" UNIT )?
 * unary      -> "-" unary | primary
 * primary    -> INTEGER UNIT? | "(" term ")"
 * </pre>
 *
 * The first lexical or syntactic error stops parsing and is thrown as a
 * {@link DiagnosticException}.
 */
public final class Parser {
	/** Maximum nesting of parentheses and unary minus. */
	public static final int MAX_DEPTH = 256;

	private final Lexer lexer;
	private Token lookahead;
	private int depth;

	public Parser(Lexer lexer) {
		this.lexer = lexer;
	}

	public static Expr parse(String source) {
		return new Parser(new Lexer(source)).parse();
	}

	public Expr parse() {
		Expr expr = term();
		Token t = peek();
		if (!t.is(TokenKind.EOF)) {
			throw error(ParseError.of(ParseErrorKind.EXPECTED_EOF, t));
		}
		return expr;
	}

	private Expr term() {
		Expr expr = factor();
		while (peek().is(TokenKind.PLUS) || peek().is(TokenKind.MINUS)) {
			Token operator = advance();
			Expr right = factor();
			expr = new Expr.Binary(expr, BinaryOperator.fromToken(operator.kind()), operator, right);
		}
		return expr;
	}

	private Expr factor() {
		Expr expr = typeCast();
		while (peek().is(TokenKind.STAR) || peek().is(TokenKind.SLASH)) {
			Token operator = advance();
			Expr right = typeCast();
			expr = new Expr.Binary(expr, BinaryOperator.fromToken(operator.kind()), operator, right);
		}
		return expr;
	}

	private Expr typeCast() {
		Expr expr = unary();
		if (peek().is(TokenKind.AS)) {
			Token as = advance();
			Token unit = peek();
			if (!unit.is(TokenKind.UNIT)) {
				throw error(ParseError.of(ParseErrorKind.EXPECTED_UNIT, unit));
			}
			advance();
			expr = new Expr.TypeCast(expr, as, unit);
		}
		return expr;
	}

	private Expr unary() {
		if (peek().is(TokenKind.MINUS)) {
			Token operator = advance();
			enter(operator);
			Expr right = unary();
			depth--;
			return new Expr.Unary(UnaryOperator.NEGATE, operator, right);
		}
		return primary();
	}

	private Expr primary() {
		Token t = peek();
		if (t.is(TokenKind.INTEGER)) {
			advance();
			Token unit = null;
			if (peek().is(TokenKind.UNIT)) {
				unit = advance();
			}
			return new Expr.Literal(t, unit);
		}
		if (t.is(TokenKind.LEFT_PAREN)) {
			advance();
			enter(t);
			Expr inner = term();
			Token close = peek();
			if (!close.is(TokenKind.RIGHT_PAREN)) {
				throw error(ParseError.unexpectedToken("')'", close));
			}
			advance();
			depth--;
			return new Expr.Grouping(inner, t.span().to(close.span()));
		}
		throw error(ParseError.of(ParseErrorKind.EXPECTED_EXPRESSION, t));
	}

	private void enter(Token at) {
		if (++depth > MAX_DEPTH) {
			throw error(ParseError.of(ParseErrorKind.NESTING_TOO_DEEP, at));
		}
	}

	private Token peek() {
		if (lookahead == null) {
			lookahead = lexer.next();
		}
		return lookahead;
	}

	private Token advance() {
		Token t = peek();
		lookahead = null;
		return t;
	}

	private static DiagnosticException error(ParseError error) {
		return new DiagnosticException(error);
	}
}
