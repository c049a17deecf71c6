package pycs.model.csharp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class CsCatchClause extends CsNode {

	private final String localName;
	private final CsTypeReference catchExceptionType;
	private final List<CsStatement> statements;

	public CsCatchClause(String localName, CsTypeReference catchExceptionType) {
		this.localName = localName;
		this.catchExceptionType = catchExceptionType;
		this.statements = new ArrayList<>();
	}

	public String getLocalName() {
		return localName;
	}

	public CsTypeReference getCatchExceptionType() {
		return catchExceptionType;
	}

	public List<CsStatement> getStatements() {
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsCatchClause that = (CsCatchClause) o;
		return Objects.equals(localName, that.localName) &&
				Objects.equals(catchExceptionType, that.catchExceptionType) &&
				Objects.equals(statements, that.statements);
	}

	@Override
	public int hashCode() {

		return Objects.hash(localName, catchExceptionType, statements);
	}
}
