package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The if statement. An empty false branch renders as no else clause.
 *
 */
public class CsConditionStatement extends CsStatement {
	private final CsExpression condition;
	private final List<CsStatement> trueStatements;
	private final List<CsStatement> falseStatements;

	public CsConditionStatement(CsExpression condition) {
		this.condition = condition;
		this.trueStatements = new ArrayList<>();
		this.falseStatements = new ArrayList<>();
	}

	public CsExpression getCondition() {
		return condition;
	}

	public List<CsStatement> getTrueStatements() {
		return trueStatements;
	}

	public List<CsStatement> getFalseStatements() {
		return falseStatements;
	}

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsConditionStatement that = (CsConditionStatement) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(trueStatements, that.trueStatements) &&
				Objects.equals(falseStatements, that.falseStatements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, trueStatements, falseStatements);
	}
}
