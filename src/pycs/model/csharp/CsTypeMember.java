package pycs.model.csharp;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Anything that can be declared inside a type: nested types, fields, methods and constructors.
 *
 */
public abstract class CsTypeMember extends CsNode {

	private final String name;
	private final EnumSet<CsMemberAttribute> attributes;
	private final List<CsAttributeDeclaration> customAttributes;

	protected CsTypeMember(String name, Set<CsMemberAttribute> attributes) {
		this.name = name;
		this.attributes = attributes.isEmpty()
				? EnumSet.noneOf(CsMemberAttribute.class)
				: EnumSet.copyOf(attributes);
		this.customAttributes = new ArrayList<>();
	}

	public String getName() {
		return name;
	}

	public Set<CsMemberAttribute> getAttributes() {
		return attributes;
	}

	public boolean hasAttribute(CsMemberAttribute attribute) {
		return attributes.contains(attribute);
	}

	// [Attribute] annotations, appended by the driver after construction
	public List<CsAttributeDeclaration> getCustomAttributes() {
		return customAttributes;
	}

	public abstract <T, E extends Throwable> T accept(CsTypeMemberVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
