package pycs.model.csharp;

import java.util.Objects;
import java.util.Optional;

/**
 * A throw statement. Without an expression it rethrows the exception being handled.
 *
 */
public class CsThrowStatement extends CsStatement {

	private final CsExpression expression;

	public CsThrowStatement(CsExpression expression) {
		this.expression = expression;
	}

	public Optional<CsExpression> getExpression() {
		return Optional.ofNullable(expression);
	}

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsThrowStatement that = (CsThrowStatement) o;
		return Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {

		return Objects.hash(expression);
	}
}
