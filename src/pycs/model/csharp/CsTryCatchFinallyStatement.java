package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class CsTryCatchFinallyStatement extends CsStatement {

	private final List<CsStatement> tryStatements;
	private final List<CsCatchClause> catchClauses;
	private final List<CsStatement> finallyStatements;

	public CsTryCatchFinallyStatement() {
		this.tryStatements = new ArrayList<>();
		this.catchClauses = new ArrayList<>();
		this.finallyStatements = new ArrayList<>();
	}

	public List<CsStatement> getTryStatements() {
		return tryStatements;
	}

	public List<CsCatchClause> getCatchClauses() {
		return catchClauses;
	}

	public List<CsStatement> getFinallyStatements() {
		return finallyStatements;
	}

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsTryCatchFinallyStatement that = (CsTryCatchFinallyStatement) o;
		return Objects.equals(tryStatements, that.tryStatements) &&
				Objects.equals(catchClauses, that.catchClauses) &&
				Objects.equals(finallyStatements, that.finallyStatements);
	}

	@Override
	public int hashCode() {

		return Objects.hash(tryStatements, catchClauses, finallyStatements);
	}
}
