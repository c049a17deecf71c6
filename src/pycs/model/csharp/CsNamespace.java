package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class CsNamespace extends CsNode {

	private final String name;
	private final List<CsNamespaceImport> imports;
	private final List<CsTypeDeclaration> types;

	public CsNamespace(String name) {
		this.name = name;
		this.imports = new ArrayList<>();
		this.types = new ArrayList<>();
	}

	public String getName() {
		return name;
	}

	public List<CsNamespaceImport> getImports() {
		return imports;
	}

	public List<CsTypeDeclaration> getTypes() {
		return types;
	}

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsNamespace that = (CsNamespace) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(imports, that.imports) &&
				Objects.equals(types, that.types);
	}

	@Override
	public int hashCode() {

		return Objects.hash(name, imports, types);
	}
}
