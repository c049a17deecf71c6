package pycs.model.csharp;

import java.util.Objects;

/**
 * A using directive. The namespace string is either a plain namespace or an
 * alias declaration of the form {@code alias = namespace}.
 *
 */
public class CsNamespaceImport extends CsNode {

	private final String namespace;

	public CsNamespaceImport(String namespace) {
		this.namespace = namespace;
	}

	public String getNamespace() {
		return namespace;
	}

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsNamespaceImport that = (CsNamespaceImport) o;
		return Objects.equals(namespace, that.namespace);
	}

	@Override
	public int hashCode() {

		return Objects.hash(namespace);
	}
}
