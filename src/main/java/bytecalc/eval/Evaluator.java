package bytecalc.eval;

import bytecalc.ast.Expr;
import bytecalc.diag.DiagnosticException;
import bytecalc.diag.ValueError;
import bytecalc.unit.Unsigned;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tree-walking evaluator. Stateless; multiplication and division are the only steps that can
 * fail, and their failures are located at the operator token.
 */
public final class Evaluator {

	public Value evaluate(Expr expr) {
		if (expr instanceof Expr.Literal literal) {
			double magnitude = Unsigned.toDouble(literal.integer().integer());
			return Value.of(magnitude, literal.hasUnit() ? literal.unit().unit() : null);
		}
		if (expr instanceof Expr.Grouping grouping) {
			return evaluate(grouping.expression());
		}
		if (expr instanceof Expr.Unary unary) {
			// NEGATE is the only unary operator
			return evaluate(unary.right()).negate();
		}
		if (expr instanceof Expr.TypeCast cast) {
			return evaluate(cast.left()).convertTo(cast.unit().unit());
		}
		if (expr instanceof Expr.Binary binary) {
			return evaluateBinary(binary);
		}
		throw new IllegalArgumentException("unknown expression node: " + expr);
	}

	// Operator chains are left-deep, so walk the left spine iteratively and fold rightwards.
	private Value evaluateBinary(Expr.Binary top) {
		Deque<Expr.Binary> spine = new ArrayDeque<>();
		Expr leftmost = top;
		while (leftmost instanceof Expr.Binary binary) {
			spine.push(binary);
			leftmost = binary.left();
		}
		Value acc = evaluate(leftmost);
		while (!spine.isEmpty()) {
			Expr.Binary binary = spine.pop();
			acc = apply(binary, acc, evaluate(binary.right()));
		}
		return acc;
	}

	private static Value apply(Expr.Binary binary, Value left, Value right) {
		try {
			switch (binary.operator()) {
				case ADD:
					return left.add(right);
				case SUBTRACT:
					return left.subtract(right);
				case MULTIPLY:
					return left.tryMultiply(right);
				case DIVIDE:
					return left.tryDivide(right);
				default:
					throw new IllegalStateException("unknown binary operator " + binary.operator());
			}
		} catch (ValueException e) {
			throw new DiagnosticException(new ValueError(e.kind(), binary.operatorToken()), e);
		}
	}
}
