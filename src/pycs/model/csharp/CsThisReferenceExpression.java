package pycs.model.csharp;

public class CsThisReferenceExpression extends CsExpression {

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return CsThisReferenceExpression.class.hashCode();
	}
}
