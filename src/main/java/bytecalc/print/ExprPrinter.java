package bytecalc.print;

import bytecalc.ast.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Prints an expression tree in prefix form, e.g. {@code (+ 1 (group (as 2KiB MB)))}.
 */
public final class ExprPrinter {
	public String print(Expr expr) {
		StringBuilder out = new StringBuilder();
		print(expr, out);
		return out.toString();
	}

	private void print(Expr expr, StringBuilder out) {
		if (expr instanceof Expr.Literal literal) {
			out.append(literal.integer());
			if (literal.hasUnit()) {
				out.append(literal.unit());
			}
		} else if (expr instanceof Expr.Grouping grouping) {
			out.append("(group ");
			print(grouping.expression(), out);
			out.append(')');
		} else if (expr instanceof Expr.Binary binary) {
			printChain(binary, out);
		} else if (expr instanceof Expr.TypeCast cast) {
			out.append("(as ");
			print(cast.left(), out);
			out.append(' ').append(cast.unit()).append(')');
		} else if (expr instanceof Expr.Unary unary) {
			out.append('(').append(unary.operator().symbol()).append(' ');
			print(unary.right(), out);
			out.append(')');
		} else {
			throw new IllegalArgumentException("unknown expression node: " + expr);
		}
	}

	private void printChain(Expr.Binary top, StringBuilder out) {
		List<Expr.Binary> spine = new ArrayList<>();
		Expr leftmost = top;
		while (leftmost instanceof Expr.Binary binary) {
			spine.add(binary);
			out.append('(').append(binary.operator().symbol()).append(' ');
			leftmost = binary.left();
		}
		print(leftmost, out);
		for (int i = spine.size() - 1; i >= 0; i--) {
			out.append(' ');
			print(spine.get(i).right(), out);
			out.append(')');
		}
	}
}
