package pycs.model.csharp;

import java.util.Objects;

public class CsVariableReferenceExpression extends CsExpression {

	private final String name;

	public CsVariableReferenceExpression(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsVariableReferenceExpression that = (CsVariableReferenceExpression) o;
		return Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {

		return Objects.hash(name);
	}
}
