package pycs.model.csharp;

import pycs.InternalCompilerError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parent links of a code model tree, keyed by node identity. Building the index fails
 * if any node is reachable under two parents.
 *
 */
public class CsContainment {

	private final CsNode root;
	private final Map<CsNode, CsNode> parents;

	private CsContainment(CsNode root) {
		this.root = root;
		this.parents = new IdentityHashMap<>();
	}

	public static CsContainment of(CsNode root) {
		CsContainment containment = new CsContainment(root);
		containment.index();
		return containment;
	}

	private void index() {
		parents.put(root, null);
		Deque<CsNode> toVisit = new ArrayDeque<>();
		toVisit.push(root);
		while (!toVisit.isEmpty()) {
			CsNode node = toVisit.pop();
			for (CsNode child : node.accept(new ChildrenVisitor())) {
				if (parents.containsKey(child)) {
					throw new InternalCompilerError(
							child.getClass().getSimpleName() + " is contained more than once");
				}
				parents.put(child, node);
				toVisit.push(child);
			}
		}
	}

	public CsNode getRoot() {
		return root;
	}

	public boolean contains(CsNode node) {
		return parents.containsKey(node);
	}

	public CsNode getParent(CsNode node) {
		if (!parents.containsKey(node)) {
			throw new InternalCompilerError(node.getClass().getSimpleName() + " is not part of this tree");
		}
		return parents.get(node);
	}

	// number of parent links between node and the root
	public int depthOf(CsNode node) {
		int depth = 0;
		CsNode current = getParent(node);
		while (current != null) {
			++depth;
			current = parents.get(current);
		}
		return depth;
	}

	public int size() {
		return parents.size();
	}

	private static void addIfPresent(List<CsNode> children, CsNode node) {
		if (node != null) {
			children.add(node);
		}
	}

	private static class ChildrenVisitor extends CsNodeVisitor<List<CsNode>, RuntimeException> {

		@Override
		public List<CsNode> visit(CsCompileUnit compileUnit) {
			return new ArrayList<>(compileUnit.getNamespaces());
		}

		@Override
		public List<CsNode> visit(CsNamespace namespace) {
			List<CsNode> children = new ArrayList<>(namespace.getImports());
			children.addAll(namespace.getTypes());
			return children;
		}

		@Override
		public List<CsNode> visit(CsNamespaceImport namespaceImport) {
			return Collections.emptyList();
		}

		@Override
		public List<CsNode> visit(CsTypeMember member) {
			List<CsNode> children = new ArrayList<>(member.getCustomAttributes());
			children.addAll(member.accept(new MemberChildrenVisitor()));
			return children;
		}

		@Override
		public List<CsNode> visit(CsParameterDeclaration parameter) {
			List<CsNode> children = new ArrayList<>();
			addIfPresent(children, parameter.getType());
			parameter.getDefaultValue().ifPresent(children::add);
			return children;
		}

		@Override
		public List<CsNode> visit(CsAttributeDeclaration attribute) {
			List<CsNode> children = new ArrayList<>();
			children.add(attribute.getAttributeType());
			children.addAll(attribute.getArguments());
			return children;
		}

		@Override
		public List<CsNode> visit(CsAttributeArgument argument) {
			return Collections.singletonList(argument.getValue());
		}

		@Override
		public List<CsNode> visit(CsStatement statement) {
			return statement.accept(new StatementChildrenVisitor());
		}

		@Override
		public List<CsNode> visit(CsCatchClause catchClause) {
			List<CsNode> children = new ArrayList<>();
			children.add(catchClause.getCatchExceptionType());
			children.addAll(catchClause.getStatements());
			return children;
		}

		@Override
		public List<CsNode> visit(CsExpression expression) {
			return expression.accept(new ExpressionChildrenVisitor());
		}
	}

	private static class MemberChildrenVisitor extends CsTypeMemberVisitor<List<CsNode>, RuntimeException> {

		@Override
		public List<CsNode> visit(CsTypeDeclaration typeDeclaration) {
			List<CsNode> children = new ArrayList<>(typeDeclaration.getBaseTypes());
			children.addAll(typeDeclaration.getMembers());
			return children;
		}

		@Override
		public List<CsNode> visit(CsMemberField field) {
			List<CsNode> children = new ArrayList<>();
			children.add(field.getType());
			field.getInitializer().ifPresent(children::add);
			return children;
		}

		@Override
		public List<CsNode> visit(CsMemberMethod method) {
			List<CsNode> children = new ArrayList<>();
			addIfPresent(children, method.getReturnType());
			children.addAll(method.getParameters());
			children.addAll(method.getStatements());
			return children;
		}

		@Override
		public List<CsNode> visit(CsConstructor constructor) {
			List<CsNode> children = new ArrayList<>(constructor.getParameters());
			children.addAll(constructor.getStatements());
			return children;
		}
	}

	private static class StatementChildrenVisitor extends CsStatementVisitor<List<CsNode>, RuntimeException> {

		@Override
		public List<CsNode> visit(CsAssignStatement assign) {
			return new ArrayList<>(Arrays.asList(assign.getLeft(), assign.getRight()));
		}

		@Override
		public List<CsNode> visit(CsConditionStatement condition) {
			List<CsNode> children = new ArrayList<>();
			children.add(condition.getCondition());
			children.addAll(condition.getTrueStatements());
			children.addAll(condition.getFalseStatements());
			return children;
		}

		@Override
		public List<CsNode> visit(CsForeachStatement foreach) {
			List<CsNode> children = new ArrayList<>();
			children.add(foreach.getVariable());
			children.add(foreach.getCollection());
			children.addAll(foreach.getStatements());
			return children;
		}

		@Override
		public List<CsNode> visit(CsPreTestLoopStatement loop) {
			List<CsNode> children = new ArrayList<>();
			children.add(loop.getTest());
			children.addAll(loop.getBody());
			return children;
		}

		@Override
		public List<CsNode> visit(CsPostTestLoopStatement loop) {
			List<CsNode> children = new ArrayList<>(loop.getBody());
			children.add(loop.getTest());
			return children;
		}

		@Override
		public List<CsNode> visit(CsTryCatchFinallyStatement tryCatchFinally) {
			List<CsNode> children = new ArrayList<>(tryCatchFinally.getTryStatements());
			children.addAll(tryCatchFinally.getCatchClauses());
			children.addAll(tryCatchFinally.getFinallyStatements());
			return children;
		}

		@Override
		public List<CsNode> visit(CsUsingStatement using) {
			List<CsNode> children = new ArrayList<>(using.getInitializers());
			children.addAll(using.getStatements());
			return children;
		}

		@Override
		public List<CsNode> visit(CsThrowStatement throwStatement) {
			List<CsNode> children = new ArrayList<>();
			throwStatement.getExpression().ifPresent(children::add);
			return children;
		}

		@Override
		public List<CsNode> visit(CsReturnStatement returnStatement) {
			List<CsNode> children = new ArrayList<>();
			returnStatement.getExpression().ifPresent(children::add);
			return children;
		}

		@Override
		public List<CsNode> visit(CsBreakStatement breakStatement) {
			return Collections.emptyList();
		}

		@Override
		public List<CsNode> visit(CsContinueStatement continueStatement) {
			return Collections.emptyList();
		}

		@Override
		public List<CsNode> visit(CsYieldStatement yield) {
			return Collections.singletonList(yield.getExpression());
		}

		@Override
		public List<CsNode> visit(CsCommentStatement comment) {
			return Collections.emptyList();
		}

		@Override
		public List<CsNode> visit(CsExpressionStatement expressionStatement) {
			return Collections.singletonList(expressionStatement.getExpression());
		}
	}

	private static class ExpressionChildrenVisitor extends CsExpressionVisitor<List<CsNode>, RuntimeException> {

		@Override
		public List<CsNode> visit(CsFieldReferenceExpression fieldReference) {
			return Collections.singletonList(fieldReference.getTarget());
		}

		@Override
		public List<CsNode> visit(CsBinaryOperatorExpression binop) {
			return new ArrayList<>(Arrays.asList(binop.getLeft(), binop.getRight()));
		}

		@Override
		public List<CsNode> visit(CsApplicationExpression application) {
			List<CsNode> children = new ArrayList<>();
			children.add(application.getFunction());
			children.addAll(application.getArguments());
			return children;
		}

		@Override
		public List<CsNode> visit(CsArrayIndexerExpression indexer) {
			List<CsNode> children = new ArrayList<>();
			children.add(indexer.getTarget());
			children.addAll(indexer.getIndices());
			return children;
		}

		@Override
		public List<CsNode> visit(CsLambdaExpression lambda) {
			List<CsNode> children = new ArrayList<>(lambda.getArguments());
			lambda.getBody().ifPresent(children::add);
			lambda.getStatements().ifPresent(children::addAll);
			return children;
		}

		@Override
		public List<CsNode> visit(CsMethodReferenceExpression methodReference) {
			return Collections.singletonList(methodReference.getTarget());
		}

		@Override
		public List<CsNode> visit(CsTypeReference typeReference) {
			return new ArrayList<>(typeReference.getTypeArguments());
		}

		@Override
		public List<CsNode> visit(CsTypeReferenceExpression typeReferenceExpression) {
			return Collections.singletonList(typeReferenceExpression.getType());
		}

		@Override
		public List<CsNode> visit(CsObjectCreateExpression objectCreate) {
			List<CsNode> children = new ArrayList<>();
			children.add(objectCreate.getType());
			children.addAll(objectCreate.getArguments());
			children.addAll(objectCreate.getInitializers());
			return children;
		}

		@Override
		public List<CsNode> visit(CsVariableReferenceExpression variableReference) {
			return Collections.emptyList();
		}

		@Override
		public List<CsNode> visit(CsPrimitiveExpression primitive) {
			return Collections.emptyList();
		}

		@Override
		public List<CsNode> visit(CsThisReferenceExpression thisReference) {
			return Collections.emptyList();
		}
	}
}
