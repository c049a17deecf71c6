package pycs.model.csharp;

import java.util.Objects;

/**
 * A literal: a number, string, character, boolean, or null when the value is null.
 *
 */
public class CsPrimitiveExpression extends CsExpression {

	private final Object value;

	public CsPrimitiveExpression(Object value) {
		this.value = value;
	}

	public Object getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsPrimitiveExpression that = (CsPrimitiveExpression) o;
		return Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {

		return Objects.hash(value);
	}
}
