package pycs.model.csharp;

import java.util.Objects;

/**
 * A type used in expression position, e.g. the {@code Math} in {@code Math.Abs(x)}.
 *
 */
public class CsTypeReferenceExpression extends CsExpression {

	private final CsTypeReference type;

	public CsTypeReferenceExpression(CsTypeReference type) {
		this.type = type;
	}

	public CsTypeReference getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsTypeReferenceExpression that = (CsTypeReferenceExpression) o;
		return Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {

		return Objects.hash(type);
	}
}
