package bytecalc.diag;

import bytecalc.ast.SourceSpan;

/**
 * Anything that can point back into the source text.
 */
public interface Located {
	SourceSpan span();
}
