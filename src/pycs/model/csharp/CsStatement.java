package pycs.model.csharp;

/**
 * A C# statement. Every statement lives in exactly one statement list: a method body,
 * a branch, a loop body, a try/catch/finally part or a using block.
 *
 */
public abstract class CsStatement extends CsNode {

	public abstract <T, E extends Throwable> T accept(CsStatementVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
