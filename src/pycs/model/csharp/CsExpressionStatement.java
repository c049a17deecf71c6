package pycs.model.csharp;

import java.util.Objects;

/**
 * An expression evaluated for its side effect
 *
 */
public class CsExpressionStatement extends CsStatement {

	private final CsExpression expression;

	public CsExpressionStatement(CsExpression expression) {
		this.expression = expression;
	}

	public CsExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsExpressionStatement that = (CsExpressionStatement) o;
		return Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {

		return Objects.hash(expression);
	}
}
