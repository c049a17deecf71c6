package pycs.model.csharp.builder;

import static org.junit.Assert.*;

import org.junit.Test;

import pycs.CodeGenOptions;
import pycs.model.csharp.CsCompileUnit;

public class CsKeywordTableTest {

	@Test
	public void testPlainIdentifiersUnchanged() {
		CsCodeGenerator gen = new CsCodeGenerator(new CsCompileUnit(), "test", "mod");
		assertEquals("foo", gen.escapeKeywordName("foo"));
		assertEquals("self", gen.escapeKeywordName("self"));
		assertEquals("print", gen.escapeKeywordName("print"));
		// contextual keywords are valid identifiers
		assertEquals("var", gen.escapeKeywordName("var"));
		assertEquals("yield", gen.escapeKeywordName("yield"));
	}

	@Test
	public void testKeywordTableIsPluggable() {
		KeywordTable python = name -> name.equals("lambda") || name.equals("def");
		CsCodeGenerator gen = new CsCodeGenerator(new CsCompileUnit(), "test", "mod",
				CodeGenOptions.defaults(), python);
		assertEquals("@lambda", gen.escapeKeywordName("lambda"));
		assertEquals("class", gen.escapeKeywordName("class"));
	}

	@Test
	public void testKnownKeywords() {
		CsKeywordTable table = new CsKeywordTable();
		assertTrue(table.needsEscaping("class"));
		assertTrue(table.needsEscaping("object"));
		assertTrue(table.needsEscaping("foreach"));
		assertFalse(table.needsEscaping("Class"));
		assertFalse(table.needsEscaping(""));
	}

}
