package bytecalc.diag;

/**
 * The single reportable failure of an interpretation, whichever stage raised it.
 *
 * Callers can render a caret from {@link #span()} without knowing the stage; the permitted
 * records carry the stage-specific kind.
 */
public sealed interface Diagnostic extends Located permits LexError, ParseError, ValueError {
	/** Human-readable summary, without location. */
	String message();
}
