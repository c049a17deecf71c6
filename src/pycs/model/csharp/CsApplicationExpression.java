package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A call, {@code function(arguments)}
 *
 */
public class CsApplicationExpression extends CsExpression {

	private final CsExpression function;
	private final List<CsExpression> arguments;

	public CsApplicationExpression(CsExpression function, List<CsExpression> arguments) {
		this.function = function;
		this.arguments = new ArrayList<>(arguments);
	}

	public CsExpression getFunction() {
		return function;
	}

	public List<CsExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsApplicationExpression that = (CsApplicationExpression) o;
		return Objects.equals(function, that.function) &&
				Objects.equals(arguments, that.arguments);
	}

	@Override
	public int hashCode() {

		return Objects.hash(function, arguments);
	}
}
