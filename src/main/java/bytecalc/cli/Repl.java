package bytecalc.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/**
 * Line-oriented read-evaluate-print loop. Stops at end of input, {@code exit} or {@code quit}.
 */
final class Repl {
	private static final String PROMPT = "> ";

	private final Main main;
	private final BufferedReader in;
	private final PrintStream out;

	Repl(Main main, BufferedReader in, PrintStream out) {
		this.main = main;
		this.in = in;
		this.out = out;
	}

	/**
	 * @return {@link Main#EXIT_OK}, or {@link Main#EXIT_FAILED} if the last expression failed
	 */
	int run() {
		int status = Main.EXIT_OK;
		while (true) {
			out.print(PROMPT);
			out.flush();
			String line;
			try {
				line = in.readLine();
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
			if (line == null) {
				out.println();
				return status;
			}
			String trimmed = line.strip();
			if (trimmed.isEmpty()) {
				continue;
			}
			if (trimmed.equals("exit") || trimmed.equals("quit")) {
				return status;
			}
			status = main.evaluate(trimmed) ? Main.EXIT_OK : Main.EXIT_FAILED;
		}
	}
}
