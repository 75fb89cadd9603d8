package bytecalc.ast;

/**
 * Half-open source span for diagnostics.
 *
 * Offsets are 0-based byte indices into the UTF-8 encoding of the source text.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public static SourceSpan of(int startOffset, int length) {
		return new SourceSpan(startOffset, startOffset + length);
	}

	public static SourceSpan at(int offset) {
		return new SourceSpan(offset, offset + 1);
	}

	public SourceSpan to(SourceSpan end) {
		return new SourceSpan(startOffset, end.endOffset);
	}
}
