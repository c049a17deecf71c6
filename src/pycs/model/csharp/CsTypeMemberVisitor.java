package pycs.model.csharp;

public abstract class CsTypeMemberVisitor<T, E extends Throwable> {

	public abstract T visit(CsTypeDeclaration typeDeclaration) throws E;
	public abstract T visit(CsMemberField field) throws E;
	public abstract T visit(CsMemberMethod method) throws E;
	public abstract T visit(CsConstructor constructor) throws E;

}
