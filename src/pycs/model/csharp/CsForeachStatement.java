package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class CsForeachStatement extends CsStatement {

	private final CsExpression variable;
	private final CsExpression collection;
	private final List<CsStatement> statements;

	public CsForeachStatement(CsExpression variable, CsExpression collection) {
		this.variable = variable;
		this.collection = collection;
		this.statements = new ArrayList<>();
	}

	public CsExpression getVariable() {
		return variable;
	}

	public CsExpression getCollection() {
		return collection;
	}

	public List<CsStatement> getStatements() {
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsForeachStatement that = (CsForeachStatement) o;
		return Objects.equals(variable, that.variable) &&
				Objects.equals(collection, that.collection) &&
				Objects.equals(statements, that.statements);
	}

	@Override
	public int hashCode() {

		return Objects.hash(variable, collection, statements);
	}
}
