package pycs.model.csharp;

public abstract class CsExpressionVisitor<T, E extends Throwable> {

	public abstract T visit(CsFieldReferenceExpression fieldReference) throws E;
	public abstract T visit(CsBinaryOperatorExpression binop) throws E;
	public abstract T visit(CsApplicationExpression application) throws E;
	public abstract T visit(CsArrayIndexerExpression indexer) throws E;
	public abstract T visit(CsLambdaExpression lambda) throws E;
	public abstract T visit(CsMethodReferenceExpression methodReference) throws E;
	public abstract T visit(CsTypeReference typeReference) throws E;
	public abstract T visit(CsTypeReferenceExpression typeReferenceExpression) throws E;
	public abstract T visit(CsObjectCreateExpression objectCreate) throws E;
	public abstract T visit(CsVariableReferenceExpression variableReference) throws E;
	public abstract T visit(CsPrimitiveExpression primitive) throws E;
	public abstract T visit(CsThisReferenceExpression thisReference) throws E;

}
