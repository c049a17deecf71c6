package pycs.model.csharp.builder;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pycs.model.csharp.CsCompileUnit;

@RunWith(Parameterized.class)
public class CsKeywordEscapingTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		List<Object[]> data = new ArrayList<>();
		for (String keyword : CsKeywordTable.KEYWORDS) {
			data.add(new Object[] { keyword });
		}
		return data;
	}

	private final String keyword;
	private final CsCodeGenerator gen;

	public CsKeywordEscapingTest(String keyword) {
		this.keyword = keyword;
		this.gen = new CsCodeGenerator(new CsCompileUnit(), "test", "mod");
	}

	@Test
	public void testKeywordEscapedOnce() {
		assertEquals("@" + keyword, gen.escapeKeywordName(keyword));
	}

	// the escaped form is an ordinary identifier; escaping it again is the driver's business
	@Test
	public void testEscapedKeywordIsNotAKeyword() {
		assertFalse(new CsKeywordTable().needsEscaping("@" + keyword));
	}

	// C# keywords are case sensitive
	@Test
	public void testCapitalizedKeywordUnchanged() {
		String capitalized = Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1);
		assertEquals(capitalized, gen.escapeKeywordName(capitalized));
	}

}
