package pycs.model.csharp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A reference to a (possibly generic) type by name, e.g. {@code Dictionary<string, object>}.
 *
 */
public class CsTypeReference extends CsExpression {

	private final String typeName;
	private final List<CsTypeReference> typeArguments;

	public CsTypeReference(String typeName) {
		this(typeName, Collections.emptyList());
	}

	public CsTypeReference(String typeName, List<CsTypeReference> typeArguments) {
		this.typeName = typeName;
		this.typeArguments = new ArrayList<>(typeArguments);
	}

	public String getTypeName() {
		return typeName;
	}

	public List<CsTypeReference> getTypeArguments() {
		return typeArguments;
	}

	@Override
	public <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsTypeReference that = (CsTypeReference) o;
		return Objects.equals(typeName, that.typeName) &&
				Objects.equals(typeArguments, that.typeArguments);
	}

	@Override
	public int hashCode() {

		return Objects.hash(typeName, typeArguments);
	}
}
