package pycs.model.csharp;

import java.util.Objects;

/**
 * {@code target.fieldName}
 *
 */
public class CsFieldReferenceExpression extends CsExpression {

	private final CsExpression target;
	private final String fieldName;

	public CsFieldReferenceExpression(CsExpression target, String fieldName) {
		this.target = target;
		this.fieldName = fieldName;
	}

	public CsExpression getTarget() {
		return target;
	}

	public String getFieldName() {
		return fieldName;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsFieldReferenceExpression that = (CsFieldReferenceExpression) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(fieldName, that.fieldName);
	}

	@Override
	public int hashCode() {

		return Objects.hash(target, fieldName);
	}
}
