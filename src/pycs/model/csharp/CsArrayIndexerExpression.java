package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class CsArrayIndexerExpression extends CsExpression {

	private final CsExpression target;
	private final List<CsExpression> indices;

	public CsArrayIndexerExpression(CsExpression target, List<CsExpression> indices) {
		this.target = target;
		this.indices = new ArrayList<>(indices);
	}

	public CsExpression getTarget() {
		return target;
	}

	public List<CsExpression> getIndices() {
		return indices;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsArrayIndexerExpression that = (CsArrayIndexerExpression) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(indices, that.indices);
	}

	@Override
	public int hashCode() {

		return Objects.hash(target, indices);
	}
}
