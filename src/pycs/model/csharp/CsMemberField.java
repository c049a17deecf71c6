package pycs.model.csharp;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public class CsMemberField extends CsTypeMember {

	private final CsTypeReference type;
	private final CsExpression initializer;

	public CsMemberField(CsTypeReference type, String name, Set<CsMemberAttribute> attributes,
	                     CsExpression initializer) {
		super(name, attributes);
		this.type = type;
		this.initializer = initializer;
	}

	public CsTypeReference getType() {
		return type;
	}

	public Optional<CsExpression> getInitializer() {
		return Optional.ofNullable(initializer);
	}

	@Override
	public <T, E extends Throwable> T accept(CsTypeMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsMemberField that = (CsMemberField) o;
		return Objects.equals(getName(), that.getName()) &&
				Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getCustomAttributes(), that.getCustomAttributes()) &&
				Objects.equals(type, that.type) &&
				Objects.equals(initializer, that.initializer);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getAttributes(), type, initializer);
	}
}
