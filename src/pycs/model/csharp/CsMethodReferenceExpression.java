package pycs.model.csharp;

import java.util.Objects;

public class CsMethodReferenceExpression extends CsExpression {

	private final CsExpression target;
	private final String methodName;

	public CsMethodReferenceExpression(CsExpression target, String methodName) {
		this.target = target;
		this.methodName = methodName;
	}

	public CsExpression getTarget() {
		return target;
	}

	public String getMethodName() {
		return methodName;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsMethodReferenceExpression that = (CsMethodReferenceExpression) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(methodName, that.methodName);
	}

	@Override
	public int hashCode() {

		return Objects.hash(target, methodName);
	}
}
