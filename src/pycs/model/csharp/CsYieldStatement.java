package pycs.model.csharp;

import java.util.Objects;

/**
 * {@code yield return expression;}
 *
 */
public class CsYieldStatement extends CsStatement {

	private final CsExpression expression;

	public CsYieldStatement(CsExpression expression) {
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
		CsYieldStatement that = (CsYieldStatement) o;
		return Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {

		return Objects.hash(expression);
	}
}
