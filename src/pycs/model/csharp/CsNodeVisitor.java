package pycs.model.csharp;

public abstract class CsNodeVisitor<T, E extends Throwable> {

	public abstract T visit(CsCompileUnit compileUnit) throws E;
	public abstract T visit(CsNamespace namespace) throws E;
	public abstract T visit(CsNamespaceImport namespaceImport) throws E;
	public abstract T visit(CsTypeMember member) throws E;
	public abstract T visit(CsParameterDeclaration parameter) throws E;
	public abstract T visit(CsAttributeDeclaration attribute) throws E;
	public abstract T visit(CsAttributeArgument argument) throws E;
	public abstract T visit(CsStatement statement) throws E;
	public abstract T visit(CsCatchClause catchClause) throws E;
	public abstract T visit(CsExpression expression) throws E;

}
