package pycs.model.csharp;

import java.util.Objects;

public class CsCommentStatement extends CsStatement {
	private final String comment;

	public CsCommentStatement(String comment) {
		this.comment = comment;
	}

	public String getComment() {
		return comment;
	}

	@Override
	public <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		CsCommentStatement that = (CsCommentStatement) o;
		return Objects.equals(comment, that.comment);
	}

	@Override
	public int hashCode() {

		return Objects.hash(comment);
	}
}
