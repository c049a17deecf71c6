package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A using block, {@code using (initializers) { statements }}; the translation of a
 * Python {@code with} statement.
 *
 */
public class CsUsingStatement extends CsStatement {

	private final List<CsStatement> initializers;
	private final List<CsStatement> statements;

	public CsUsingStatement() {
		this.initializers = new ArrayList<>();
		this.statements = new ArrayList<>();
	}

	public List<CsStatement> getInitializers() {
		return initializers;
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
		CsUsingStatement that = (CsUsingStatement) o;
		return Objects.equals(initializers, that.initializers) &&
				Objects.equals(statements, that.statements);
	}

	@Override
	public int hashCode() {

		return Objects.hash(initializers, statements);
	}
}
