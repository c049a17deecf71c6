package pycs.model.csharp.builder;

import static org.junit.Assert.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;

import org.junit.Before;
import org.junit.Test;

import pycs.InternalCompilerError;
import pycs.model.csharp.CsMemberAttribute;
import pycs.model.csharp.CsNamespace;
import pycs.model.csharp.CsStatement;
import pycs.model.csharp.CsTypeDeclaration;

public class CsScopeBuilderTest {

	private Deque<CsScopeBuilder> frames;
	private CsCodeGenContext root;

	@Before
	public void setup() {
		frames = new ArrayDeque<>();
		CsNamespace ns = new CsNamespace("test");
		CsTypeDeclaration type = new CsTypeDeclaration("mod", true, EnumSet.of(CsMemberAttribute.STATIC));
		root = new CsCodeGenContext(new ArrayList<CsStatement>(), type, null, ns, false);
	}

	@Test
	public void testOpenAndClose() {
		try (CsScopeBuilder outer = new CsScopeBuilder(frames, root)) {
			assertSame(outer, frames.peek());
			try (CsScopeBuilder inner = new CsScopeBuilder(frames, root.withScope(new ArrayList<>()))) {
				assertSame(inner, frames.peek());
				assertEquals(2, frames.size());
			}
			assertSame(outer, frames.peek());
		}
		assertTrue(frames.isEmpty());
	}

	@Test
	public void testCloseTwiceIsHarmless() {
		CsScopeBuilder frame = new CsScopeBuilder(frames, root);
		frame.close();
		assertTrue(frame.isClosed());
		frame.close();
		assertTrue(frames.isEmpty());
	}

	@Test(expected = InternalCompilerError.class)
	public void testOutOfOrderClose() {
		CsScopeBuilder outer = new CsScopeBuilder(frames, root);
		new CsScopeBuilder(frames, root.withMethod(null));
		outer.close();
	}

	@Test
	public void testDerivedContextsAreDistinct() {
		CsCodeGenContext derived = root.withScope(new ArrayList<>());
		assertNotEquals(root, derived);
		assertSame(root.getType(), derived.getType());
		assertEquals(root, root.withScope(root.getScope()));
		assertNotEquals(root, root.withDirectToNamespace(true));
	}

}
