package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root of the code model: the namespaces of one translated module, in emission order.
 *
 */
public class CsCompileUnit extends CsNode {

	private final List<CsNamespace> namespaces;

	public CsCompileUnit() {
		this.namespaces = new ArrayList<>();
	}

	public List<CsNamespace> getNamespaces() {
		return namespaces;
	}

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsCompileUnit that = (CsCompileUnit) o;
		return Objects.equals(namespaces, that.namespaces);
	}

	@Override
	public int hashCode() {

		return Objects.hash(namespaces);
	}
}
