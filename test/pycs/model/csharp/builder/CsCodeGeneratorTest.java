package pycs.model.csharp.builder;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import pycs.InternalCompilerError;
import pycs.model.csharp.*;

public class CsCodeGeneratorTest {

	private CsCompileUnit unit;
	private CsCodeGenerator gen;

	@Before
	public void setup() {
		unit = new CsCompileUnit();
		gen = new CsCodeGenerator(unit, "test.pkg", "mod");
	}

	private static CsExpression id(String name) {
		return new CsVariableReferenceExpression(name);
	}

	private static CsExpression num(int value) {
		return new CsPrimitiveExpression(value);
	}

	private static List<CsTypeDeclaration> typesNamed(List<? extends CsTypeMember> members, String name) {
		List<CsTypeDeclaration> result = new ArrayList<>();
		for (CsTypeMember member : members) {
			if (member instanceof CsTypeDeclaration && name.equals(member.getName())) {
				result.add((CsTypeDeclaration) member);
			}
		}
		return result;
	}

	@Test
	public void testSeededModule() {
		assertEquals(1, unit.getNamespaces().size());
		CsNamespace ns = unit.getNamespaces().get(0);
		assertEquals("test.pkg", ns.getName());
		assertEquals(1, ns.getTypes().size());
		CsTypeDeclaration moduleType = ns.getTypes().get(0);
		assertEquals("mod", moduleType.getName());
		assertTrue(moduleType.isClass());
		assertTrue(moduleType.hasAttribute(CsMemberAttribute.PUBLIC));
		assertTrue(moduleType.hasAttribute(CsMemberAttribute.STATIC));
		assertSame(moduleType, gen.getCurrentType());
		assertSame(ns, gen.getCurrentNamespace());
		assertNull(gen.getCurrentMethod());
		assertFalse(gen.isDirectToNamespace());
		assertEquals(1, gen.getDepth());
	}

	@Test
	public void testInitModuleIsDirectToNamespace() {
		CsCodeGenerator init = new CsCodeGenerator(new CsCompileUnit(), "test.pkg", "__init__");
		assertTrue(init.isDirectToNamespace());
	}

	// package initializer: classes become namespace members
	@Test
	public void testScenarioA() {
		CsCompileUnit initUnit = new CsCompileUnit();
		CsCodeGenerator init = new CsCodeGenerator(initUnit, "test.pkg", "__init__");
		CsTypeDeclaration moduleType = init.getCurrentType();

		init.classDecl("Point", Collections.emptyList(), () -> {
			init.field("x");
			init.field("y");
		});

		CsNamespace ns = initUnit.getNamespaces().get(0);
		List<CsTypeDeclaration> points = typesNamed(ns.getTypes(), "Point");
		assertEquals(1, points.size());
		CsTypeDeclaration point = points.get(0);
		assertEquals(2, point.getMembers().size());
		assertThat(point.getMembers().get(0), instanceOf(CsMemberField.class));
		assertEquals("x", point.getMembers().get(0).getName());
		assertEquals("y", point.getMembers().get(1).getName());
		assertTrue(moduleType.getMembers().isEmpty());
	}

	@Test
	public void testScenarioB() {
		CsMemberMethod method = gen.method("f", Collections.emptyList(), () ->
				gen.ifStmt(id("cond"),
						() -> gen.assign(id("a"), num(1)),
						() -> gen.assign(id("a"), num(2))));

		assertEquals(1, method.getStatements().size());
		assertThat(method.getStatements().get(0), instanceOf(CsConditionStatement.class));
		CsConditionStatement i = (CsConditionStatement) method.getStatements().get(0);
		assertEquals(id("cond"), i.getCondition());
		assertEquals(Collections.singletonList(new CsAssignStatement(id("a"), num(1))), i.getTrueStatements());
		assertEquals(Collections.singletonList(new CsAssignStatement(id("a"), num(2))), i.getFalseStatements());
	}

	@Test
	public void testScenarioC() {
		List<List<CsStatement>> scopesAfter = new ArrayList<>();
		CsMemberMethod method = gen.method("f", Collections.emptyList(), () -> {
			gen.whileLoop(id("cond1"), () ->
					gen.whileLoop(id("cond2"), gen::breakStmt));
			scopesAfter.add(gen.getScope());
		});

		assertEquals(1, scopesAfter.size());
		assertSame(method.getStatements(), scopesAfter.get(0));
		CsPreTestLoopStatement outer = (CsPreTestLoopStatement) method.getStatements().get(0);
		CsPreTestLoopStatement inner = (CsPreTestLoopStatement) outer.getBody().get(0);
		assertNotSame(outer.getBody(), scopesAfter.get(0));
		assertNotSame(inner.getBody(), scopesAfter.get(0));
		assertEquals(Collections.singletonList(new CsBreakStatement()), inner.getBody());
	}

	// every construct with a body leaves the context exactly as it found it
	@Test
	public void testScopeBalance() {
		CsCodeGenContext before = gen.getContext();
		CsCatchClause clause = gen.catchClause("e", gen.typeRef("Exception"), () -> {
			gen.foreach(id("x"), id("xs"), () -> gen.doWhile(() -> gen.continueStmt(), id("c")));
			gen.throwStmt();
		});
		assertEquals(before, gen.getContext());

		gen.tryStmt(
				() -> gen.usingBlock(Collections.emptyList(), () ->
						gen.ifStmt(id("c"),
								() -> gen.whileLoop(id("d"), () -> gen.sideEffect(gen.appl(id("g")))),
								() -> gen.returnStmt(num(0)))),
				Collections.singletonList(clause),
				() -> gen.comment("done"));
		assertEquals(before, gen.getContext());
		assertSame(before.getScope(), gen.getScope());
		assertEquals(1, gen.getDepth());
	}

	@Test
	public void testNestingDepthDuringCallbacks() {
		List<Integer> depths = new ArrayList<>();
		gen.method("f", Collections.emptyList(), () -> {
			depths.add(gen.getDepth());
			gen.ifStmt(id("c"), () -> {
				depths.add(gen.getDepth());
				gen.foreach(id("x"), id("xs"), () -> depths.add(gen.getDepth()));
			}, () -> depths.add(gen.getDepth()));
		});
		assertEquals(Arrays.asList(2, 3, 4, 3), depths);
		assertEquals(1, gen.getDepth());
	}

	@Test
	public void testContextRestoredWhenCallbackThrows() {
		CsCodeGenContext before = gen.getContext();
		try {
			gen.method("f", Collections.emptyList(), () ->
					gen.whileLoop(id("c"), () ->
							gen.ifStmt(id("d"), () -> {
								throw new IllegalStateException("boom");
							}, () -> {})));
			fail("exception should propagate");
		} catch (IllegalStateException e) {
			assertEquals("boom", e.getMessage());
		}
		assertEquals(before, gen.getContext());
		assertEquals(1, gen.getDepth());

		// still usable afterwards
		gen.assign(id("a"), num(1));
		assertEquals(1, gen.getScope().size());
		assertSame(unit, gen.getCompileUnit());
	}

	@Test
	public void testClassContextRestoredWhenBodyThrows() {
		CsTypeDeclaration moduleType = gen.getCurrentType();
		try {
			gen.method("outer", Collections.emptyList(), () ->
					gen.classDecl("Inner", Collections.emptyList(), () -> {
						throw new UnsupportedOperationException("nope");
					}));
			fail("exception should propagate");
		} catch (UnsupportedOperationException e) {
			assertEquals("nope", e.getMessage());
		}
		assertSame(moduleType, gen.getCurrentType());
		assertNull(gen.getCurrentMethod());
	}

	@Test
	public void testClassNestsInCurrentType() {
		CsTypeDeclaration moduleType = gen.getCurrentType();
		CsNamespace ns = gen.getCurrentNamespace();
		CsTypeDeclaration c = gen.classDecl("Point", Arrays.asList("Base", "IComparable"), () -> {
			assertSame(gen.getCurrentType(), moduleType.getMembers().get(0));
			assertNull(gen.getCurrentMethod());
		});

		assertEquals(Collections.singletonList(c), moduleType.getMembers());
		assertTrue(typesNamed(ns.getTypes(), "Point").isEmpty());
		assertEquals(Arrays.asList(new CsTypeReference("Base"), new CsTypeReference("IComparable")),
				c.getBaseTypes());
		assertSame(moduleType, gen.getCurrentType());
	}

	@Test
	public void testClassInsideInitClassNests() {
		CsCompileUnit initUnit = new CsCompileUnit();
		CsCodeGenerator init = new CsCodeGenerator(initUnit, "test.pkg", "__init__");
		List<Boolean> flags = new ArrayList<>();
		CsTypeDeclaration outer = init.classDecl("Outer", Collections.emptyList(), () -> {
			flags.add(init.isDirectToNamespace());
			init.classDecl("Inner", Collections.emptyList(), () -> {});
		});

		assertEquals(Collections.singletonList(false), flags);
		assertTrue(init.isDirectToNamespace());
		CsNamespace ns = initUnit.getNamespaces().get(0);
		assertEquals(1, typesNamed(ns.getTypes(), "Outer").size());
		assertTrue(typesNamed(ns.getTypes(), "Inner").isEmpty());
		assertEquals(1, typesNamed(outer.getMembers(), "Inner").size());
	}

	@Test
	public void testMethodIsMemberBeforeBodyRuns() {
		CsTypeDeclaration moduleType = gen.getCurrentType();
		List<Boolean> seen = new ArrayList<>();
		CsMemberMethod[] current = new CsMemberMethod[1];
		CsMemberMethod m = gen.method("f", Collections.singletonList(gen.param(gen.typeRef("object"), "x")), () -> {
			seen.add(moduleType.getMembers().contains(gen.getCurrentMethod()));
			current[0] = gen.getCurrentMethod();
		});

		assertEquals(Collections.singletonList(true), seen);
		assertSame(m, current[0]);
		assertEquals("f", m.getName());
		assertEquals(new CsTypeReference("object"), m.getReturnType());
		assertEquals(1, m.getParameters().size());
		assertTrue(m.hasAttribute(CsMemberAttribute.PUBLIC));
		assertFalse(m.hasAttribute(CsMemberAttribute.STATIC));
		assertNull(gen.getCurrentMethod());
	}

	@Test
	public void testStaticMethodAndConstructor() {
		CsMemberMethod s = gen.staticMethod("main", Collections.emptyList(), () -> gen.returnStmt());
		CsConstructor cons = gen.constructor(
				Collections.singletonList(gen.param(gen.typeRef("int"), "n", num(3))),
				() -> gen.assign(gen.access(new CsThisReferenceExpression(), "n"), id("n")));

		assertTrue(s.hasAttribute(CsMemberAttribute.STATIC));
		assertEquals(Collections.singletonList(new CsReturnStatement(null)), s.getStatements());
		assertTrue(cons.hasAttribute(CsMemberAttribute.PUBLIC));
		assertTrue(cons.hasAttribute(CsMemberAttribute.FINAL));
		assertNull(cons.getName());
		assertEquals(num(3), cons.getParameters().get(0).getDefaultValue().get());
		assertEquals(1, cons.getStatements().size());
		assertEquals(Arrays.asList(s, cons), gen.getCurrentType().getMembers());
	}

	@Test
	public void testMethodInsideClassBelongsToClass() {
		CsTypeDeclaration moduleType = gen.getCurrentType();
		CsTypeDeclaration[] owner = new CsTypeDeclaration[1];
		CsTypeDeclaration c = gen.classDecl("C", Collections.emptyList(), () -> {
			gen.method("m", Collections.emptyList(), () -> owner[0] = gen.getCurrentType());
		});
		assertSame(c, owner[0]);
		assertEquals(1, c.getMembers().size());
		assertEquals(Collections.singletonList(c), moduleType.getMembers());
	}

	@Test
	public void testLambdaMethodIsDetached() {
		CsTypeDeclaration moduleType = gen.getCurrentType();
		CsMemberMethod body = gen.lambdaMethod(Collections.emptyList(), () -> gen.returnStmt(num(1)));
		CsExpression lambda = gen.lambda(Collections.singletonList(id("x")), body.getStatements());

		assertTrue(moduleType.getMembers().isEmpty());
		assertTrue(gen.getScope().isEmpty());
		assertEquals(Collections.singletonList(new CsReturnStatement(num(1))),
				((CsLambdaExpression) lambda).getStatements().get());
	}

	@Test
	public void testFields() {
		CsMemberField plain = gen.field("count");
		CsMemberField initialized = gen.field("items", num(0));

		assertFalse(plain.getInitializer().isPresent());
		assertEquals(num(0), initialized.getInitializer().get());
		assertEquals(new CsTypeReference("object"), plain.getType());
		assertTrue(plain.hasAttribute(CsMemberAttribute.PUBLIC));
		assertEquals(Arrays.asList(plain, initialized), gen.getCurrentType().getMembers());
	}

	@Test
	public void testLeafStatementsAppendInOrder() {
		CsMemberMethod m = gen.method("f", Collections.emptyList(), () -> {
			gen.comment("hello");
			gen.assign(id("a"), num(1));
			gen.sideEffect(gen.appl(id("print"), id("a")));
			gen.yieldStmt(id("a"));
			gen.throwStmt(gen.appl(id("Exception")));
			gen.throwStmt();
			gen.breakStmt();
			gen.continueStmt();
			gen.returnStmt(id("a"));
		});

		List<CsStatement> expected = Arrays.asList(
				new CsCommentStatement("hello"),
				new CsAssignStatement(id("a"), num(1)),
				new CsExpressionStatement(new CsApplicationExpression(id("print"), Collections.singletonList(id("a")))),
				new CsYieldStatement(id("a")),
				new CsThrowStatement(new CsApplicationExpression(id("Exception"), Collections.emptyList())),
				new CsThrowStatement(null),
				new CsBreakStatement(),
				new CsContinueStatement(),
				new CsReturnStatement(id("a")));
		assertEquals(expected, m.getStatements());
		assertFalse(((CsThrowStatement) m.getStatements().get(5)).getExpression().isPresent());
	}

	// the builder does not check that break sits inside a loop
	@Test
	public void testBreakOutsideLoopAccepted() {
		CsMemberMethod m = gen.method("f", Collections.emptyList(), gen::breakStmt);
		assertEquals(Collections.singletonList(new CsBreakStatement()), m.getStatements());
	}

	@Test
	public void testTryCatchFinally() {
		CsMemberMethod m = gen.method("f", Collections.emptyList(), () -> {
			CsCatchClause clause = gen.catchClause("ex", gen.typeRef("KeyError"), () -> gen.returnStmt(num(0)));
			assertTrue("catch clause is not a statement of the current scope", gen.getScope().isEmpty());
			gen.tryStmt(
					() -> gen.returnStmt(gen.aref(id("d"), id("k"))),
					Collections.singletonList(clause),
					() -> gen.sideEffect(gen.appl(id("cleanup"))));
		});

		assertEquals(1, m.getStatements().size());
		CsTryCatchFinallyStatement t = (CsTryCatchFinallyStatement) m.getStatements().get(0);
		assertEquals(Collections.singletonList(new CsReturnStatement(
				new CsArrayIndexerExpression(id("d"), Collections.singletonList(id("k"))))), t.getTryStatements());
		assertEquals(1, t.getCatchClauses().size());
		CsCatchClause clause = t.getCatchClauses().get(0);
		assertEquals("ex", clause.getLocalName());
		assertEquals(new CsTypeReference("KeyError"), clause.getCatchExceptionType());
		assertEquals(Collections.singletonList(new CsReturnStatement(num(0))), clause.getStatements());
		assertEquals(1, t.getFinallyStatements().size());
	}

	@Test
	public void testUsingBlockAndLoops() {
		CsStatement init = new CsAssignStatement(id("f"), gen.appl(id("open"), new CsPrimitiveExpression("x.txt")));
		CsMemberMethod m = gen.method("f", Collections.emptyList(), () -> {
			gen.usingBlock(Collections.singletonList(init), () -> gen.sideEffect(gen.appl(id("read"))));
			gen.foreach(id("x"), id("xs"), () -> gen.yieldStmt(id("x")));
			gen.doWhile(() -> gen.assign(id("i"), num(0)), id("more"));
		});

		CsUsingStatement u = (CsUsingStatement) m.getStatements().get(0);
		assertEquals(Collections.singletonList(init), u.getInitializers());
		assertEquals(1, u.getStatements().size());
		CsForeachStatement f = (CsForeachStatement) m.getStatements().get(1);
		assertEquals(id("x"), f.getVariable());
		assertEquals(id("xs"), f.getCollection());
		assertEquals(Collections.singletonList(new CsYieldStatement(id("x"))), f.getStatements());
		CsPostTestLoopStatement dw = (CsPostTestLoopStatement) m.getStatements().get(2);
		assertEquals(id("more"), dw.getTest());
		assertEquals(1, dw.getBody().size());
	}

	@Test
	public void testExpressionsHaveNoSideEffects() {
		CsExpression e = gen.binOp(gen.access(id("self"), "x"), CsOperator.ADD, num(1));
		gen.methodRef(id("self"), "run");
		gen.typeRefExpr("Math");
		gen.lambda(Collections.singletonList(id("x")), id("x"));
		gen.aref(id("a"), num(0), num(1));

		assertTrue(gen.getScope().isEmpty());
		assertTrue(gen.getCurrentNamespace().getImports().isEmpty());
		assertEquals(new CsBinaryOperatorExpression(
				new CsFieldReferenceExpression(id("self"), "x"), CsOperator.ADD, num(1)), e);
	}

	@Test
	public void testTypeRefWithGenericArguments() {
		CsTypeReference t = gen.typeRef("Dictionary", "string", "object");
		assertEquals("Dictionary", t.getTypeName());
		assertEquals(Arrays.asList(new CsTypeReference("string"), new CsTypeReference("object")),
				t.getTypeArguments());
		assertTrue(gen.typeRef("int").getTypeArguments().isEmpty());
		assertEquals(new CsTypeReferenceExpression(new CsTypeReference("Math")), gen.typeRefExpr("Math"));
	}

	@Test
	public void testListInitializerImportsCollections() {
		CsExpression list = gen.listInitializer(Arrays.asList(num(1), num(2)));
		gen.listInitializer(Collections.emptyList());

		assertEquals(new CsObjectCreateExpression(
				new CsTypeReference("List", Collections.singletonList(new CsTypeReference("object"))),
				Collections.emptyList(),
				Arrays.asList(num(1), num(2))), list);
		assertEquals(Collections.singletonList(new CsNamespaceImport("System.Collections.Generic")),
				gen.getCurrentNamespace().getImports());
	}

	@Test
	public void testEnsureImportIsIdempotent() {
		gen.ensureImport("System");
		gen.ensureImport("System");
		assertEquals(Collections.singletonList(new CsNamespaceImport("System")),
				gen.getCurrentNamespace().getImports());

		gen.ensureImport("System.Linq");
		assertEquals(Arrays.asList(new CsNamespaceImport("System"), new CsNamespaceImport("System.Linq")),
				gen.getCurrentNamespace().getImports());
	}

	@Test
	public void testUsingAlwaysAppends() {
		gen.using("System");
		gen.using("System");
		gen.using("np", "numpy");
		gen.using("string", "Text");
		gen.ensureImport("System");

		assertEquals(Arrays.asList(
				new CsNamespaceImport("System"),
				new CsNamespaceImport("System"),
				new CsNamespaceImport("np = numpy"),
				new CsNamespaceImport("@string = Text")),
				gen.getCurrentNamespace().getImports());
	}

	@Test
	public void testCustomAttrUnsupported() {
		CsTypeDeclaration moduleType = gen.getCurrentType();
		try {
			gen.customAttr(gen.typeRef("Serializable"));
			fail("custom attributes should be unsupported");
		} catch (UnsupportedOperationException e) {
			assertThat(e.getMessage(), containsString("custom attributes"));
		}
		assertTrue(moduleType.getCustomAttributes().isEmpty());
		assertTrue(gen.getScope().isEmpty());
	}

	@Test
	public void testDriverMayDecorateReturnedNodes() {
		CsMemberMethod m = gen.method("f", Collections.emptyList(), () -> {});
		CsAttributeDeclaration attr = new CsAttributeDeclaration(new CsTypeReference("Obsolete"),
				Collections.singletonList(new CsAttributeArgument(null, new CsPrimitiveExpression("old"))));
		m.getCustomAttributes().add(attr);
		assertEquals(Collections.singletonList(attr),
				((CsTypeMember) gen.getCurrentType().getMembers().get(0)).getCustomAttributes());
	}

	@Test(expected = InternalCompilerError.class)
	public void testCompileUnitRefusedWhileBodyOpen() {
		gen.method("f", Collections.emptyList(), () -> gen.getCompileUnit());
	}

	@Test
	public void testCompileUnitIsAcyclic() {
		gen.classDecl("C", Collections.singletonList("object"), () -> {
			gen.field("x", num(0));
			gen.method("m", Collections.singletonList(gen.param(gen.typeRef("object"), "y")), () ->
					gen.ifStmt(gen.binOp(id("y"), CsOperator.GREATER_THAN, num(0)),
							() -> gen.whileLoop(id("c"), () -> gen.assign(id("z"), gen.listInitializer(
									Collections.singletonList(num(1))))),
							() -> gen.returnStmt()));
		});

		CsContainment containment = CsContainment.of(gen.getCompileUnit());
		CsTypeDeclaration c = (CsTypeDeclaration) gen.getCurrentType().getMembers().get(0);
		CsMemberMethod m = (CsMemberMethod) c.getMembers().get(1);
		CsConditionStatement i = (CsConditionStatement) m.getStatements().get(0);
		CsPreTestLoopStatement w = (CsPreTestLoopStatement) i.getTrueStatements().get(0);

		// unit > namespace > module type > C > m > if > while > assign
		assertEquals(7, containment.depthOf(w.getBody().get(0)));
		assertSame(w, containment.getParent(w.getBody().get(0)));
		assertSame(unit, containment.getParent(unit.getNamespaces().get(0)));
		assertEquals(0, containment.depthOf(unit));
	}
}
