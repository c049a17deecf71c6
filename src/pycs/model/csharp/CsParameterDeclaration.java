package pycs.model.csharp;

import java.util.Objects;
import java.util.Optional;

public class CsParameterDeclaration extends CsNode {

	private final CsTypeReference type;
	private final String name;
	private final CsExpression defaultValue;

	public CsParameterDeclaration(CsTypeReference type, String name, CsExpression defaultValue) {
		this.type = type;
		this.name = name;
		this.defaultValue = defaultValue;
	}

	public CsTypeReference getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	public Optional<CsExpression> getDefaultValue() {
		return Optional.ofNullable(defaultValue);
	}

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsParameterDeclaration that = (CsParameterDeclaration) o;
		return Objects.equals(type, that.type) &&
				Objects.equals(name, that.name) &&
				Objects.equals(defaultValue, that.defaultValue);
	}

	@Override
	public int hashCode() {

		return Objects.hash(type, name, defaultValue);
	}
}
