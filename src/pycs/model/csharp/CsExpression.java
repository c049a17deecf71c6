package pycs.model.csharp;

/**
 * A C# expression base class
 *
 */
public abstract class CsExpression extends CsNode {

	public abstract <T, E extends Throwable> T accept(CsExpressionVisitor<T, E> visitor) throws E;

	@Override
	public <T, E extends Throwable> T accept(CsNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
