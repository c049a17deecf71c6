package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code new Type(arguments) { initializers }}
 *
 */
public class CsObjectCreateExpression extends CsExpression {

	private final CsTypeReference type;
	private final List<CsExpression> arguments;
	private final List<CsExpression> initializers;

	public CsObjectCreateExpression(CsTypeReference type, List<CsExpression> arguments,
	                                List<CsExpression> initializers) {
		this.type = type;
		this.arguments = new ArrayList<>(arguments);
		this.initializers = new ArrayList<>(initializers);
	}

	public CsTypeReference getType() {
		return type;
	}

	public List<CsExpression> getArguments() {
		return arguments;
	}

	public List<CsExpression> getInitializers() {
		return initializers;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsObjectCreateExpression that = (CsObjectCreateExpression) o;
		return Objects.equals(type, that.type) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(initializers, that.initializers);
	}

	@Override
	public int hashCode() {

		return Objects.hash(type, arguments, initializers);
	}
}
