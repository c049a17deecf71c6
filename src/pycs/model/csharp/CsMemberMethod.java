package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A method declaration. Its statement list is the scope its body is emitted into.
 *
 */
public class CsMemberMethod extends CsTypeMember {

	private final CsTypeReference returnType;
	private final List<CsParameterDeclaration> parameters;
	private final List<CsStatement> statements;

	public CsMemberMethod(String name, CsTypeReference returnType, Set<CsMemberAttribute> attributes,
	                      List<CsParameterDeclaration> parameters) {
		super(name, attributes);
		this.returnType = returnType;
		this.parameters = new ArrayList<>(parameters);
		this.statements = new ArrayList<>();
	}

	// null for constructors and lambda bodies
	public CsTypeReference getReturnType() {
		return returnType;
	}

	public List<CsParameterDeclaration> getParameters() {
		return parameters;
	}

	public List<CsStatement> getStatements() {
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(CsTypeMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsMemberMethod that = (CsMemberMethod) o;
		return Objects.equals(getName(), that.getName()) &&
				Objects.equals(getAttributes(), that.getAttributes()) &&
				Objects.equals(getCustomAttributes(), that.getCustomAttributes()) &&
				Objects.equals(returnType, that.returnType) &&
				Objects.equals(parameters, that.parameters) &&
				Objects.equals(statements, that.statements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getAttributes(), returnType, parameters, statements);
	}
}
