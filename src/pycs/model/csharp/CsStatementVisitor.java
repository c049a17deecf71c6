package pycs.model.csharp;

public abstract class CsStatementVisitor<T, E extends Throwable> {

	public abstract T visit(CsAssignStatement assign) throws E;
	public abstract T visit(CsConditionStatement condition) throws E;
	public abstract T visit(CsForeachStatement foreach) throws E;
	public abstract T visit(CsPreTestLoopStatement loop) throws E;
	public abstract T visit(CsPostTestLoopStatement loop) throws E;
	public abstract T visit(CsTryCatchFinallyStatement tryCatchFinally) throws E;
	public abstract T visit(CsUsingStatement using) throws E;
	public abstract T visit(CsThrowStatement throwStatement) throws E;
	public abstract T visit(CsReturnStatement returnStatement) throws E;
	public abstract T visit(CsBreakStatement breakStatement) throws E;
	public abstract T visit(CsContinueStatement continueStatement) throws E;
	public abstract T visit(CsYieldStatement yield) throws E;
	public abstract T visit(CsCommentStatement comment) throws E;
	public abstract T visit(CsExpressionStatement expressionStatement) throws E;

}
