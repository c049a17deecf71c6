package pycs.model.csharp;

public class CsBreakStatement extends CsStatement {

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return CsBreakStatement.class.hashCode();
	}
}
