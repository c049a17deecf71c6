package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code while (test) { body }}
 *
 */
public class CsPreTestLoopStatement extends CsStatement {

	private final CsExpression test;
	private final List<CsStatement> body;

	public CsPreTestLoopStatement(CsExpression test) {
		this.test = test;
		this.body = new ArrayList<>();
	}

	public CsExpression getTest() {
		return test;
	}

	public List<CsStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsPreTestLoopStatement that = (CsPreTestLoopStatement) o;
		return Objects.equals(test, that.test) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {

		return Objects.hash(test, body);
	}
}
