package bytecalc;

import bytecalc.ast.Expr;
import bytecalc.diag.Diagnostic;
import bytecalc.diag.DiagnosticException;
import bytecalc.eval.Evaluator;
import bytecalc.eval.Value;
import bytecalc.parse.Lexer;
import bytecalc.parse.Parser;

import java.util.Objects;

/**
 * Entry point of the expression pipeline: source text to one {@link Value} or one located
 * {@link Diagnostic}. Holds no state, so one instance may be shared between threads.
 */
public final class Interpreter {
	private final Evaluator evaluator = new Evaluator();

	/**
	 * Parses and evaluates {@code source}, e.g. {@code "1 + 2 KiB + 3 MiB"}.
	 */
	public Result<Value, Diagnostic> interpret(String source) {
		Objects.requireNonNull(source, "source");
		try {
			Expr expr = new Parser(new Lexer(source)).parse();
			return Result.ok(evaluator.evaluate(expr));
		} catch (DiagnosticException e) {
			return Result.err(e.diagnostic());
		}
	}

	/**
	 * Parses {@code source} without evaluating it.
	 */
	public Result<Expr, Diagnostic> parse(String source) {
		Objects.requireNonNull(source, "source");
		try {
			return Result.ok(new Parser(new Lexer(source)).parse());
		} catch (DiagnosticException e) {
			return Result.err(e.diagnostic());
		}
	}
}
