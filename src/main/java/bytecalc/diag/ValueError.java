package bytecalc.diag;

import bytecalc.ast.SourceSpan;
import bytecalc.parse.Token;

/**
 * A unit-algebra failure, located at the operator that triggered it.
 */
public record ValueError(ValueErrorKind kind, Token operator) implements Diagnostic {
	@Override
	public SourceSpan span() {
		return operator.span();
	}

	@Override
	public String message() {
		return kind.message();
	}
}
