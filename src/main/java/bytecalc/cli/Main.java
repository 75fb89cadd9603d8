package bytecalc.cli;

import bytecalc.Interpreter;
import bytecalc.Result;
import bytecalc.ast.Expr;
import bytecalc.diag.Diagnostic;
import bytecalc.diag.DiagnosticRenderer;
import bytecalc.eval.Value;
import bytecalc.format.SizeFormat;
import bytecalc.parse.Lexer;
import bytecalc.print.ExprPrinter;
import bytecalc.unit.FullUnit;
import bytecalc.unit.Unsigned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Command line front end. Each argument is interpreted and printed as {@code <input> = <value>};
 * without arguments expressions are read from standard input.
 */
public class Main {
	private static final Logger LOG = LoggerFactory.getLogger(Main.class);

	static final int EXIT_OK = 0;
	static final int EXIT_FAILED = 1;
	static final int EXIT_USAGE = 2;

	private static final String GREEN = "\u001B[32m";
	private static final String RESET = "\u001B[0m";

	private final Interpreter interpreter = new Interpreter();
	private final ExprPrinter printer = new ExprPrinter();
	private final CliOptions options;
	private final DiagnosticRenderer renderer;
	private final PrintStream out;
	private final PrintStream err;

	Main(CliOptions options, PrintStream out, PrintStream err) {
		this.options = options;
		this.renderer = new DiagnosticRenderer(options.color());
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		System.exit(run(args, in, System.out, System.err, System.getenv()));
	}

	static int run(String[] args, BufferedReader in, PrintStream out, PrintStream err, Map<String, String> env) {
		CliOptions options;
		try {
			options = CliOptions.parse(args, env);
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			err.println(CliOptions.USAGE);
			return EXIT_USAGE;
		}
		if (options.help()) {
			out.println(CliOptions.USAGE);
			return EXIT_OK;
		}

		Main main = new Main(options, out, err);
		if (options.expressions().isEmpty()) {
			try {
				return new Repl(main, in, out).run();
			} catch (UncheckedIOException e) {
				LOG.error("Failed to read expressions from standard input", e);
				return EXIT_FAILED;
			}
		}

		int status = EXIT_OK;
		for (String expression : options.expressions()) {
			if (!main.evaluate(expression)) {
				status = EXIT_FAILED;
			}
		}
		return status;
	}

	/**
	 * Interprets one expression and prints its result or diagnostic.
	 *
	 * @return whether interpretation succeeded
	 */
	boolean evaluate(String source) {
		if (LOG.isDebugEnabled()) {
			try {
				LOG.debug("tokens of '{}': {}", source, Lexer.tokenize(source));
			} catch (RuntimeException e) {
				LOG.debug("'{}' does not lex: {}", source, e.getMessage());
			}
		}

		if (options.tree()) {
			Result<Expr, Diagnostic> parsed = interpreter.parse(source);
			if (parsed instanceof Result.Ok<Expr, Diagnostic> ok) {
				out.println(printer.print(ok.value()));
			}
		}

		Result<Value, Diagnostic> result = interpreter.interpret(source);
		if (result instanceof Result.Err<Value, Diagnostic> failure) {
			LOG.debug("'{}' failed with {}", source, failure.error());
			err.print(renderer.render(source, failure.error()));
			return false;
		}

		Value value = result.unwrap();
		out.println(source + " = " + value);
		if (options.stats()) {
			printStats(value);
		}
		return true;
	}

	private void printStats(Value value) {
		Value bytes = value.hasUnit() ? value.convertTo(FullUnit.BYTE) : value;
		if (bytes.magnitude() != Math.floor(bytes.magnitude())) {
			// fractional bytes or NaN
			out.println("(no size statistics for " + value + ")");
			return;
		}
		long magnitude;
		try {
			magnitude = Unsigned.fromDouble(bytes.magnitude());
		} catch (IllegalArgumentException e) {
			out.println("(no size statistics for " + value + ")");
			return;
		}
		out.println(label("Decimal") + ":\t" + Unsigned.toString(magnitude));
		out.println(label("Hex") + ":\t\t0x" + Long.toHexString(magnitude).toUpperCase(Locale.ROOT));
		out.println(label("Octal") + ":\t\t0o" + Long.toOctalString(magnitude));
		out.println(label("Binary") + ":\t\t" + SizeFormat.binaryGroups(magnitude));
		out.println(label("Decimal Size") + ":\t" + SizeFormat.decimalSize(magnitude));
		out.println(label("Binary Size") + ":\t" + SizeFormat.binarySize(magnitude));
	}

	private String label(String text) {
		return options.color() ? GREEN + text + RESET : text;
	}
}
