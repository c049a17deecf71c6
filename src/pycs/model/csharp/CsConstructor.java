package pycs.model.csharp;

import java.util.List;
import java.util.Set;

public class CsConstructor extends CsMemberMethod {

	public CsConstructor(Set<CsMemberAttribute> attributes, List<CsParameterDeclaration> parameters) {
		super(null, null, attributes, parameters);
	}

	@Override
	public <T, E extends Throwable> T accept(CsTypeMemberVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
