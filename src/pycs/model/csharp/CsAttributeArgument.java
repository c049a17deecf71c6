package pycs.model.csharp;

import java.util.Objects;
import java.util.Optional;

public class CsAttributeArgument extends CsNode {

	// null for positional arguments
	private final String name;
	private final CsExpression value;

	public CsAttributeArgument(String name, CsExpression value) {
		this.name = name;
		this.value = value;
	}

	public Optional<String> getName() {
		return Optional.ofNullable(name);
	}

	public CsExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsAttributeArgument that = (CsAttributeArgument) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {

		return Objects.hash(name, value);
	}
}
