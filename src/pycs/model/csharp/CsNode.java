package pycs.model.csharp;

public abstract class CsNode {

	public abstract <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

}
