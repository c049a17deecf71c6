package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A class (or other type) declaration. It is owned either by a namespace or by an
 * enclosing type, never both.
 *
 */
public class CsTypeDeclaration extends CsTypeMember {

	private final boolean isClass;
	private final List<CsTypeReference> baseTypes;
	private final List<CsTypeMember> members;

	public CsTypeDeclaration(String name, boolean isClass, Set<CsMemberAttribute> attributes) {
		super(name, attributes);
		this.isClass = isClass;
		this.baseTypes = new ArrayList<>();
		this.members = new ArrayList<>();
	}

	public boolean isClass() {
		return isClass;
	}

	public List<CsTypeReference> getBaseTypes() {
		return baseTypes;
	}

	public List<CsTypeMember> getMembers() {
		return members;
	}

	@Override
	public <T, E extends Throwable> T accept(CsTypeMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsTypeDeclaration that = (CsTypeDeclaration) o;
		return isClass == that.isClass &&
				Objects.equals(getName(), that.getName()) &&
				Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getCustomAttributes(), that.getCustomAttributes()) &&
				Objects.equals(baseTypes, that.baseTypes) &&
				Objects.equals(members, that.members);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), isClass, getAttributes(), baseTypes, members);
	}
}
