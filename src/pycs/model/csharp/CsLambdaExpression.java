package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A lambda with either an expression body, {@code (args) => expr}, or a statement
 * body, {@code (args) => { statements }}. Exactly one of the two is present.
 *
 */
public class CsLambdaExpression extends CsExpression {

	private final List<CsExpression> arguments;
	private final CsExpression body;
	private final List<CsStatement> statements;

	public CsLambdaExpression(List<CsExpression> arguments, CsExpression body) {
		this.arguments = new ArrayList<>(arguments);
		this.body = body;
		this.statements = null;
	}

	public CsLambdaExpression(List<CsExpression> arguments, List<CsStatement> statements) {
		this.arguments = new ArrayList<>(arguments);
		this.body = null;
		this.statements = statements;
	}

	public List<CsExpression> getArguments() {
		return arguments;
	}

	public Optional<CsExpression> getBody() {
		return Optional.ofNullable(body);
	}

	public Optional<List<CsStatement>> getStatements() {
		return Optional.ofNullable(statements);
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsLambdaExpression that = (CsLambdaExpression) o;
		return Objects.equals(arguments, that.arguments) &&
				Objects.equals(body, that.body) &&
				Objects.equals(statements, that.statements);
	}

	@Override
	public int hashCode() {

		return Objects.hash(arguments, body, statements);
	}
}
