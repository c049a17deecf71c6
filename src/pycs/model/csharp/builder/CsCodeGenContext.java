package pycs.model.csharp.builder;

import pycs.model.csharp.CsMemberMethod;
import pycs.model.csharp.CsNamespace;
import pycs.model.csharp.CsStatement;
import pycs.model.csharp.CsTypeDeclaration;

import java.util.List;

/**
 * Where the code generator is currently emitting: the statement list receiving new statements,
 * the enclosing type, method and namespace, and whether declared classes go straight into the
 * namespace. Contexts are immutable; nested constructs derive a new one with the with* methods.
 *
 * Two contexts are equal when they point at the very same scope list and nodes.
 */
public final class CsCodeGenContext {

	private final List<CsStatement> scope;
	private final CsTypeDeclaration type;
	private final CsMemberMethod method;
	private final CsNamespace namespace;
	private final boolean directToNamespace;

	public CsCodeGenContext(List<CsStatement> scope, CsTypeDeclaration type, CsMemberMethod method,
	                        CsNamespace namespace, boolean directToNamespace) {
		this.scope = scope;
		this.type = type;
		this.method = method;
		this.namespace = namespace;
		this.directToNamespace = directToNamespace;
	}

	public List<CsStatement> getScope() {
		return scope;
	}

	public CsTypeDeclaration getType() {
		return type;
	}

	// null outside of any method body
	public CsMemberMethod getMethod() {
		return method;
	}

	public CsNamespace getNamespace() {
		return namespace;
	}

	public boolean isDirectToNamespace() {
		return directToNamespace;
	}

	public CsCodeGenContext withScope(List<CsStatement> scope) {
		return new CsCodeGenContext(scope, type, method, namespace, directToNamespace);
	}

	public CsCodeGenContext withType(CsTypeDeclaration type) {
		return new CsCodeGenContext(scope, type, method, namespace, directToNamespace);
	}

	public CsCodeGenContext withMethod(CsMemberMethod method) {
		return new CsCodeGenContext(scope, type, method, namespace, directToNamespace);
	}

	public CsCodeGenContext withDirectToNamespace(boolean directToNamespace) {
		return new CsCodeGenContext(scope, type, method, namespace, directToNamespace);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsCodeGenContext that = (CsCodeGenContext) o;
		return scope == that.scope &&
				type == that.type &&
				method == that.method &&
				namespace == that.namespace &&
				directToNamespace == that.directToNamespace;
	}

	@Override
	public int hashCode() {
		int result = System.identityHashCode(scope);
		result = 31 * result + System.identityHashCode(type);
		result = 31 * result + System.identityHashCode(method);
		result = 31 * result + System.identityHashCode(namespace);
		result = 31 * result + (directToNamespace ? 1 : 0);
		return result;
	}
}
