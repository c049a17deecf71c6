package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A custom attribute, e.g. {@code [Serializable]}, attached to a type member.
 *
 */
public class CsAttributeDeclaration extends CsNode {

	private final CsTypeReference attributeType;
	private final List<CsAttributeArgument> arguments;

	public CsAttributeDeclaration(CsTypeReference attributeType, List<CsAttributeArgument> arguments) {
		this.attributeType = attributeType;
		this.arguments = new ArrayList<>(arguments);
	}

	public CsTypeReference getAttributeType() {
		return attributeType;
	}

	public List<CsAttributeArgument> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsAttributeDeclaration that = (CsAttributeDeclaration) o;
		return Objects.equals(attributeType, that.attributeType) &&
				Objects.equals(arguments, that.arguments);
	}

	@Override
	public int hashCode() {

		return Objects.hash(attributeType, arguments);
	}
}
