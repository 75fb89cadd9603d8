package bytecalc.parse;

import bytecalc.ast.BinaryOperator;
import bytecalc.ast.Expr;
import bytecalc.ast.SourceSpan;
import bytecalc.ast.UnaryOperator;
import bytecalc.diag.DiagnosticException;
import bytecalc.diag.LexError;
import bytecalc.diag.LexErrorKind;
import bytecalc.diag.ParseError;
import bytecalc.diag.ParseErrorKind;
import bytecalc.print.ExprPrinter;
import bytecalc.unit.FullUnit;
import bytecalc.unit.Unit;
import bytecalc.unit.UnitPrefix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ParserTest {
	@Test
	void literalKeepsItsUnitToken() {
		Expr.Literal literal = assertInstanceOf(Expr.Literal.class, Parser.parse("42 KiB"));
		assertEquals(42L, literal.integer().integer());
		assertEquals(FullUnit.of(UnitPrefix.KIBI, Unit.BYTE), literal.unit().unit());
		assertEquals(new SourceSpan(0, 6), literal.span());

		Expr.Literal bare = assertInstanceOf(Expr.Literal.class, Parser.parse("7"));
		assertNull(bare.unit());
	}

	@Test
	void binaryNodeKeepsOperatorToken() {
		Expr.Binary sum = assertInstanceOf(Expr.Binary.class, Parser.parse("1 + 2"));
		assertEquals(BinaryOperator.ADD, sum.operator());
		assertEquals(Token.of(TokenKind.PLUS, new SourceSpan(2, 3)), sum.operatorToken());
		assertEquals(new SourceSpan(0, 5), sum.span());
	}

	@Test
	void multiplicationBindsTighterThanAddition() {
		assertEquals("(+ 1 (* 2 3))", tree("1 + 2 * 3"));
		assertEquals("(- (/ 6 2) 1)", tree("6 / 2 - 1"));
	}

	@Test
	void binaryOperatorsAreLeftAssociative() {
		assertEquals("(- (- 1 2) 3)", tree("1 - 2 - 3"));
		assertEquals("(/ (* 8 2) 4)", tree("8 * 2 / 4"));
	}

	@Test
	void unaryMinusStacks() {
		Expr.Unary outer = assertInstanceOf(Expr.Unary.class, Parser.parse("--5"));
		assertEquals(UnaryOperator.NEGATE, outer.operator());
		assertInstanceOf(Expr.Unary.class, outer.right());
		assertEquals("(- (- 5))", tree("--5"));
		assertEquals("(- 1 (- 2))", tree("1 - -2"));
	}

	@Test
	void castAppliesToTheUnaryOperand() {
		assertEquals("(as (- 5) KiB)", tree("-5 as KiB"));
		assertEquals("(* (as 2KiB MiB) 3)", tree("2 KiB as MiB * 3"));
		assertEquals("(as (group (+ 1 2KiB)) B)", tree("(1 + 2 KiB) as B"));
	}

	@Test
	void groupingSpansBothParentheses() {
		Expr.Grouping group = assertInstanceOf(Expr.Grouping.class, Parser.parse("(1 + 2)"));
		assertEquals(new SourceSpan(0, 7), group.span());
	}

	@Test
	void reportsMissingClosingParenthesis() {
		ParseError error = parseError("(1 + 2");
		assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, error.kind());
		assertEquals("')'", error.expected());
		assertEquals(TokenKind.EOF, error.found().kind());
		assertEquals(new SourceSpan(6, 6), error.span());
	}

	@Test
	void reportsMissingExpression() {
		assertParseError("", ParseErrorKind.EXPECTED_EXPRESSION, new SourceSpan(0, 0));
		assertParseError("1 +", ParseErrorKind.EXPECTED_EXPRESSION, new SourceSpan(3, 3));
		assertParseError("* 2", ParseErrorKind.EXPECTED_EXPRESSION, new SourceSpan(0, 1));
		assertParseError("KiB", ParseErrorKind.EXPECTED_EXPRESSION, new SourceSpan(0, 3));
	}

	@Test
	void reportsTrailingTokens() {
		assertParseError("1 2", ParseErrorKind.EXPECTED_EOF, new SourceSpan(2, 3));
		assertParseError("(1 + 2) KiB", ParseErrorKind.EXPECTED_EOF, new SourceSpan(8, 11));
		assertParseError("1 as KiB as MiB", ParseErrorKind.EXPECTED_EOF, new SourceSpan(9, 11));
		assertParseError("1 )", ParseErrorKind.EXPECTED_EOF, new SourceSpan(2, 3));
	}

	@Test
	void reportsCastWithoutUnit() {
		assertParseError("1 as as", ParseErrorKind.EXPECTED_UNIT, new SourceSpan(5, 7));
		assertParseError("1 as", ParseErrorKind.EXPECTED_UNIT, new SourceSpan(4, 4));
		assertParseError("1 as 2", ParseErrorKind.EXPECTED_UNIT, new SourceSpan(5, 6));
	}

	@Test
	void lexicalErrorsStopParsing() {
		DiagnosticException e = assertThrows(DiagnosticException.class, () -> Parser.parse("1 + $ + )"));
		LexError error = assertInstanceOf(LexError.class, e.diagnostic());
		assertEquals(LexErrorKind.UNEXPECTED_CHARACTER, error.kind());
		assertEquals(4, error.offset());
	}

	@Test
	void limitsNestingDepth() {
		String unaries = "-".repeat(Parser.MAX_DEPTH);
		assertEquals(Expr.Unary.class, Parser.parse(unaries + "1").getClass());

		ParseError tooDeep = parseError("-".repeat(Parser.MAX_DEPTH + 1) + "1");
		assertEquals(ParseErrorKind.NESTING_TOO_DEEP, tooDeep.kind());
		assertEquals(SourceSpan.of(Parser.MAX_DEPTH, 1), tooDeep.span());
		assertEquals("Nesting limit of 256 exceeded at '-'", tooDeep.message());

		String groups = "(".repeat(1000) + "1" + ")".repeat(1000);
		assertEquals(ParseErrorKind.NESTING_TOO_DEEP, parseError(groups).kind());
	}

	private static String tree(String source) {
		return new ExprPrinter().print(Parser.parse(source));
	}

	private static void assertParseError(String source, ParseErrorKind kind, SourceSpan span) {
		ParseError error = parseError(source);
		assertEquals(kind, error.kind(), source);
		assertEquals(span, error.span(), source);
	}

	private static ParseError parseError(String source) {
		DiagnosticException e = assertThrows(DiagnosticException.class, () -> Parser.parse(source));
		return assertInstanceOf(ParseError.class, e.diagnostic());
	}
}
