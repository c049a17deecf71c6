package pycs.model.csharp.builder;

import pycs.CodeGenOptions;
import pycs.InternalCompilerError;
import pycs.model.csharp.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the C# code model of one translated Python module.
 *
 * The translator calls one method per construct, in the order the code should appear. Statements
 * are appended to the current scope. Constructs with bodies (branches, loops, try/catch, using
 * blocks, methods, classes) take callbacks; while a callback runs, the current scope is the
 * construct's own statement list, and the previous context is restored when it returns or throws.
 */
public class CsCodeGenerator {

	private static final Logger logger = Logger.getLogger(CsCodeGenerator.class.getName());

	private final CsCompileUnit unit;
	private final CodeGenOptions options;
	private final KeywordTable keywords;
	private final Deque<CsScopeBuilder> frames;

	public CsCodeGenerator(CsCompileUnit unit, String modulePath, String moduleName) {
		this(unit, modulePath, moduleName, CodeGenOptions.defaults(), new CsKeywordTable());
	}

	public CsCodeGenerator(CsCompileUnit unit, String modulePath, String moduleName, CodeGenOptions options,
	                       KeywordTable keywords) {
		this.unit = unit;
		this.options = options;
		this.keywords = keywords;
		this.frames = new ArrayDeque<>();

		CsNamespace namespace = new CsNamespace(modulePath);
		CsTypeDeclaration moduleType = new CsTypeDeclaration(moduleName, true, options.getModuleAttributes());
		namespace.getTypes().add(moduleType);
		unit.getNamespaces().add(namespace);

		boolean isInit = options.getInitModuleName().equals(moduleName);
		// statements emitted outside of any body land in this detached list
		new CsScopeBuilder(frames, new CsCodeGenContext(new ArrayList<>(), moduleType, null, namespace, isInit));
		logger.fine("Seeded module " + modulePath + "." + moduleName + (isInit ? " (package initializer)" : ""));
	}

	private CsCodeGenContext context() {
		return frames.peek().getContext();
	}

	private CsScopeBuilder enter(CsCodeGenContext context) {
		return new CsScopeBuilder(frames, context);
	}

	private void emitInto(List<CsStatement> scope, Runnable body) {
		try (CsScopeBuilder ignored = enter(context().withScope(scope))) {
			body.run();
		}
	}

	private void addStatement(CsStatement statement) {
		context().getScope().add(statement);
	}

	public CsCodeGenContext getContext() {
		return context();
	}

	public List<CsStatement> getScope() {
		return context().getScope();
	}

	public CsTypeDeclaration getCurrentType() {
		return context().getType();
	}

	public CsMemberMethod getCurrentMethod() {
		return context().getMethod();
	}

	public CsNamespace getCurrentNamespace() {
		return context().getNamespace();
	}

	public boolean isDirectToNamespace() {
		return context().isDirectToNamespace();
	}

	// number of open context frames, 1 when no body is being emitted
	public int getDepth() {
		return frames.size();
	}

	/**
	 * The finished compile unit.
	 *
	 * @throws InternalCompilerError if called from inside a body callback
	 */
	public CsCompileUnit getCompileUnit() {
		if (frames.size() != 1) {
			throw new InternalCompilerError("compile unit requested while " + (frames.size() - 1) +
					" construct(s) are still open");
		}
		return unit;
	}

	// expressions

	public CsExpression access(CsExpression exp, String fieldName) {
		return new CsFieldReferenceExpression(exp, fieldName);
	}

	public CsBinaryOperatorExpression binOp(CsExpression l, CsOperator op, CsExpression r) {
		return new CsBinaryOperatorExpression(l, op, r);
	}

	public CsExpression appl(CsExpression fn, CsExpression... args) {
		return appl(fn, Arrays.asList(args));
	}

	public CsExpression appl(CsExpression fn, List<CsExpression> args) {
		return new CsApplicationExpression(fn, args);
	}

	public CsArrayIndexerExpression aref(CsExpression exp, CsExpression... indices) {
		return new CsArrayIndexerExpression(exp, Arrays.asList(indices));
	}

	public CsExpression lambda(List<CsExpression> args, CsExpression expr) {
		return new CsLambdaExpression(args, expr);
	}

	public CsExpression lambda(List<CsExpression> args, List<CsStatement> statements) {
		return new CsLambdaExpression(args, statements);
	}

	public CsExpression methodRef(CsExpression exp, String methodName) {
		return new CsMethodReferenceExpression(exp, methodName);
	}

	public CsTypeReference typeRef(String typeName) {
		return new CsTypeReference(typeName);
	}

	public CsTypeReference typeRef(String typeName, String... genericArgs) {
		List<CsTypeReference> args = new ArrayList<>();
		for (String arg : genericArgs) {
			args.add(new CsTypeReference(arg));
		}
		return new CsTypeReference(typeName, args);
	}

	public CsExpression typeRefExpr(String typeName) {
		return new CsTypeReferenceExpression(new CsTypeReference(typeName));
	}

	/**
	 * {@code new List<object> { exprs }}. Imports the collections namespace as a side effect.
	 */
	public CsExpression listInitializer(List<CsExpression> exprs) {
		CsObjectCreateExpression list = new CsObjectCreateExpression(
				typeRef("List", options.getDefaultMemberType()),
				Collections.emptyList(),
				exprs);
		ensureImport(options.getCollectionsNamespace());
		return list;
	}

	public CsParameterDeclaration param(CsTypeReference type, String name) {
		return new CsParameterDeclaration(type, name, null);
	}

	public CsParameterDeclaration param(CsTypeReference type, String name, CsExpression defaultValue) {
		return new CsParameterDeclaration(type, name, defaultValue);
	}

	// statements

	public CsAssignStatement assign(CsExpression lhs, CsExpression rhs) {
		CsAssignStatement ass = new CsAssignStatement(lhs, rhs);
		addStatement(ass);
		return ass;
	}

	public CsExpressionStatement sideEffect(CsExpression exp) {
		CsExpressionStatement sideEffect = new CsExpressionStatement(exp);
		addStatement(sideEffect);
		return sideEffect;
	}

	public CsThrowStatement throwStmt() {
		return throwStmt(null);
	}

	public CsThrowStatement throwStmt(CsExpression exp) {
		CsThrowStatement t = new CsThrowStatement(exp);
		addStatement(t);
		return t;
	}

	public CsReturnStatement returnStmt() {
		return returnStmt(null);
	}

	public CsReturnStatement returnStmt(CsExpression exp) {
		CsReturnStatement r = new CsReturnStatement(exp);
		addStatement(r);
		return r;
	}

	public CsBreakStatement breakStmt() {
		CsBreakStatement b = new CsBreakStatement();
		addStatement(b);
		return b;
	}

	public CsContinueStatement continueStmt() {
		CsContinueStatement c = new CsContinueStatement();
		addStatement(c);
		return c;
	}

	public CsYieldStatement yieldStmt(CsExpression exp) {
		CsYieldStatement y = new CsYieldStatement(exp);
		addStatement(y);
		return y;
	}

	public CsCommentStatement comment(String comment) {
		CsCommentStatement c = new CsCommentStatement(comment);
		addStatement(c);
		return c;
	}

	public CsConditionStatement ifStmt(CsExpression test, Runnable xlatThen, Runnable xlatElse) {
		CsConditionStatement i = new CsConditionStatement(test);
		addStatement(i);
		emitInto(i.getTrueStatements(), xlatThen);
		emitInto(i.getFalseStatements(), xlatElse);
		return i;
	}

	public CsForeachStatement foreach(CsExpression exp, CsExpression list, Runnable xlatLoopBody) {
		CsForeachStatement f = new CsForeachStatement(exp, list);
		addStatement(f);
		emitInto(f.getStatements(), xlatLoopBody);
		return f;
	}

	public CsPreTestLoopStatement whileLoop(CsExpression exp, Runnable generateBody) {
		CsPreTestLoopStatement w = new CsPreTestLoopStatement(exp);
		addStatement(w);
		emitInto(w.getBody(), generateBody);
		return w;
	}

	public CsPostTestLoopStatement doWhile(Runnable generateBody, CsExpression exp) {
		CsPostTestLoopStatement dw = new CsPostTestLoopStatement(exp);
		addStatement(dw);
		emitInto(dw.getBody(), generateBody);
		return dw;
	}

	/**
	 * Builds a catch clause without adding it anywhere; pass it on to {@link #tryStmt}.
	 */
	public CsCatchClause catchClause(String localName, CsTypeReference type, Runnable generateClauseBody) {
		CsCatchClause clause = new CsCatchClause(localName, type);
		emitInto(clause.getStatements(), generateClauseBody);
		return clause;
	}

	public CsTryCatchFinallyStatement tryStmt(Runnable genTryStatements, List<CsCatchClause> catchClauses,
	                                          Runnable genFinallyStatements) {
		CsTryCatchFinallyStatement t = new CsTryCatchFinallyStatement();
		addStatement(t);
		emitInto(t.getTryStatements(), genTryStatements);
		t.getCatchClauses().addAll(catchClauses);
		emitInto(t.getFinallyStatements(), genFinallyStatements);
		return t;
	}

	public CsUsingStatement usingBlock(List<CsStatement> initializers, Runnable xlatUsingBody) {
		CsUsingStatement u = new CsUsingStatement();
		addStatement(u);
		u.getInitializers().addAll(initializers);
		emitInto(u.getStatements(), xlatUsingBody);
		return u;
	}

	// declarations

	/**
	 * Declares a class and emits its members. In a package initializer module the class becomes
	 * a member of the namespace, anywhere else it nests inside the current type.
	 */
	public CsTypeDeclaration classDecl(String name, List<String> baseClasses, Runnable body) {
		CsCodeGenContext ctx = context();
		CsTypeDeclaration c = new CsTypeDeclaration(name, true, EnumSet.noneOf(CsMemberAttribute.class));
		if (ctx.isDirectToNamespace()) {
			ctx.getNamespace().getTypes().add(c);
			logger.fine("Placing class " + name + " directly in namespace " + ctx.getNamespace().getName());
		} else {
			ctx.getType().getMembers().add(c);
		}
		for (String b : baseClasses) {
			c.getBaseTypes().add(new CsTypeReference(b));
		}
		try (CsScopeBuilder ignored = enter(ctx.withType(c).withMethod(null).withDirectToNamespace(false))) {
			body.run();
		}
		return c;
	}

	public CsMemberField field(String fieldName) {
		return field(fieldName, null);
	}

	public CsMemberField field(String fieldName, CsExpression initializer) {
		CsMemberField field = new CsMemberField(
				typeRef(options.getDefaultMemberType()),
				fieldName,
				EnumSet.of(CsMemberAttribute.PUBLIC),
				initializer);
		context().getType().getMembers().add(field);
		return field;
	}

	public CsConstructor constructor(List<CsParameterDeclaration> parms, Runnable body) {
		CsConstructor cons = new CsConstructor(EnumSet.of(CsMemberAttribute.PUBLIC, CsMemberAttribute.FINAL), parms);
		context().getType().getMembers().add(cons);
		generateMethodBody(cons, body);
		return cons;
	}

	public CsMemberMethod method(String name, List<CsParameterDeclaration> parms, Runnable body) {
		return addMethod(name, EnumSet.of(CsMemberAttribute.PUBLIC), parms, body);
	}

	public CsMemberMethod staticMethod(String name, List<CsParameterDeclaration> parms, Runnable body) {
		return addMethod(name, EnumSet.of(CsMemberAttribute.PUBLIC, CsMemberAttribute.STATIC), parms, body);
	}

	private CsMemberMethod addMethod(String name, EnumSet<CsMemberAttribute> attributes,
	                                 List<CsParameterDeclaration> parms, Runnable body) {
		CsMemberMethod method = new CsMemberMethod(name, typeRef(options.getDefaultMemberType()), attributes, parms);
		context().getType().getMembers().add(method);
		generateMethodBody(method, body);
		return method;
	}

	/**
	 * A method that belongs to no type; its statements become the body of a statement lambda.
	 */
	public CsMemberMethod lambdaMethod(List<CsParameterDeclaration> parms, Runnable body) {
		CsMemberMethod method = new CsMemberMethod(null, null, EnumSet.noneOf(CsMemberAttribute.class), parms);
		generateMethodBody(method, body);
		return method;
	}

	private void generateMethodBody(CsMemberMethod method, Runnable body) {
		try (CsScopeBuilder ignored = enter(context().withMethod(method).withScope(method.getStatements()))) {
			body.run();
		}
	}

	public CsAttributeDeclaration customAttr(CsTypeReference typeRef, CsAttributeArgument... args) {
		throw new UnsupportedOperationException("custom attributes are not supported by the code generator");
	}

	// imports

	public void using(String namespace) {
		context().getNamespace().getImports().add(new CsNamespaceImport(namespace));
	}

	public void using(String alias, String namespace) {
		context().getNamespace().getImports().add(new CsNamespaceImport(
				escapeKeywordName(alias) +
				" = " +
				escapeKeywordName(namespace)));
	}

	public void ensureImport(String namespace) {
		List<CsNamespaceImport> imports = context().getNamespace().getImports();
		for (CsNamespaceImport i : imports) {
			if (i.getNamespace().equals(namespace)) {
				return;
			}
		}
		imports.add(new CsNamespaceImport(namespace));
	}

	public String escapeKeywordName(String name) {
		return keywords.needsEscaping(name)
				? options.getEscapeMarker() + name
				: name;
	}
}
