package pycs.model.csharp;

import java.util.Objects;

public class CsAssignStatement extends CsStatement {

	private final CsExpression left;
	private final CsExpression right;

	public CsAssignStatement(CsExpression left, CsExpression right) {
		this.left = left;
		this.right = right;
	}

	public CsExpression getLeft() {
		return left;
	}

	public CsExpression getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsAssignStatement that = (CsAssignStatement) o;
		return Objects.equals(left, that.left) &&
				Objects.equals(right, that.right);
	}

	@Override
	public int hashCode() {

		return Objects.hash(left, right);
	}
}
