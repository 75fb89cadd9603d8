package bytecalc.diag;

import bytecalc.ast.SourceSpan;

import java.nio.charset.StandardCharsets;

/**
 * Renders a diagnostic as a message followed by the offending source line and a caret underline:
 *
 * <pre>
 * error: Cannot multiply two values with units
 *   1 KiB * 2 KiB
 *         ^
 * </pre>
 */
public final class DiagnosticRenderer {
	private static final String RED = "\u001B[31;1m";
	private static final String BOLD = "\u001B[1m";
	private static final String RESET = "\u001B[0m";
	private static final String INDENT = "  ";

	private final boolean color;

	public DiagnosticRenderer(boolean color) {
		this.color = color;
	}

	public String render(String source, Diagnostic diagnostic) {
		byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
		SourceSpan span = diagnostic.span();
		int start = Math.max(0, Math.min(span.startOffset(), bytes.length));
		int end = Math.max(start, Math.min(span.endOffset(), bytes.length));

		int lineStart = start;
		while (lineStart > 0 && bytes[lineStart - 1] != '\n') {
			lineStart--;
		}
		int lineEnd = start;
		while (lineEnd < bytes.length && bytes[lineEnd] != '\n' && bytes[lineEnd] != '\r') {
			lineEnd++;
		}
		end = Math.min(end, lineEnd);

		String line = decode(bytes, lineStart, lineEnd);
		int column = decode(bytes, lineStart, start).length();
		// zero-width spans (end of input) still get one caret
		int width = Math.max(1, decode(bytes, start, end).length());

		String nl = System.lineSeparator();
		StringBuilder out = new StringBuilder();
		out.append(paint(RED, "error")).append(paint(BOLD, ": " + diagnostic.message())).append(nl);
		out.append(INDENT).append(line).append(nl);
		out.append(INDENT).append(" ".repeat(column)).append(paint(RED, "^".repeat(width))).append(nl);
		return out.toString();
	}

	private String paint(String style, String text) {
		return color ? style + text + RESET : text;
	}

	private static String decode(byte[] bytes, int from, int to) {
		return new String(bytes, from, to - from, StandardCharsets.UTF_8);
	}
}
