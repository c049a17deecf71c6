package pycs.model.csharp;

import java.util.Objects;

public class CsBinaryOperatorExpression extends CsExpression {

	private final CsExpression left;
	private final CsOperator operator;
	private final CsExpression right;

	public CsBinaryOperatorExpression(CsExpression left, CsOperator operator, CsExpression right) {
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public CsExpression getLeft() {
		return left;
	}

	public CsOperator getOperator() {
		return operator;
	}

	public CsExpression getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsBinaryOperatorExpression that = (CsBinaryOperatorExpression) o;
		return Objects.equals(left, that.left) &&
				operator == that.operator &&
				Objects.equals(right, that.right);
	}

	@Override
	public int hashCode() {

		return Objects.hash(left, operator, right);
	}
}
