package bytecalc.diag;

import java.util.Objects;

/**
 * Carries a {@link Diagnostic} out of the lexer, parser or evaluator.
 */
public class DiagnosticException extends RuntimeException {
	private final Diagnostic diagnostic;

	public DiagnosticException(Diagnostic diagnostic) {
		super(Objects.requireNonNull(diagnostic, "diagnostic").message());
		this.diagnostic = diagnostic;
	}

	public DiagnosticException(Diagnostic diagnostic, Throwable cause) {
		super(Objects.requireNonNull(diagnostic, "diagnostic").message(), cause);
		this.diagnostic = diagnostic;
	}

	public Diagnostic diagnostic() {
		return diagnostic;
	}
}
