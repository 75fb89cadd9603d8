package bytecalc.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parsed command line. Only the exact flags below are options; any other argument, including
 * one starting with {@code -} such as {@code -5 KiB}, is an expression.
 */
record CliOptions(boolean stats, boolean tree, boolean color, boolean help, List<String> expressions) {
	static final String USAGE = "usage: bytecalc [--stats] [--tree] [--no-color] [<expression>...]";

	/**
	 * @throws IllegalArgumentException on an unknown {@code --} flag
	 */
	static CliOptions parse(String[] args, Map<String, String> env) {
		boolean stats = false;
		boolean tree = false;
		boolean color = !env.containsKey("NO_COLOR");
		boolean help = false;
		List<String> expressions = new ArrayList<>();
		for (String arg : args) {
			switch (arg) {
				case "--stats":
					stats = true;
					break;
				case "--tree":
					tree = true;
					break;
				case "--no-color":
					color = false;
					break;
				case "-h":
				case "--help":
					help = true;
					break;
				default:
					if (arg.startsWith("--")) {
						throw new IllegalArgumentException("unknown option: " + arg);
					}
					expressions.add(arg);
			}
		}
		return new CliOptions(stats, tree, color, help, List.copyOf(expressions));
	}
}
