package pennTreebank;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.junit.Test;

public class PennTreebankReaderTests {
	static final String FIXTURE = "( (S (S-TPC-1 (NP-SBJ (PRP xx) ) (ADVP (RB xx) ) (VP (VBZ xx) (NP-PRD (DT xx)(NN xx)(NN xx)))) (, ,) (NP-SBJ (NNS xx) ) (VP (VBP xx) (SBAR (-NONE- 0)(S (-NONE- *T*-1)))) (. .)))";

	private PennTreebankReader reader(String text) throws IOException {
		return new PennTreebankReader(new StringReader(text));
	}

	@Test
	public void testFixture() {
		List<TreeNode> trees = PennTreebankReader.parse(FIXTURE);
		assertEquals(1, trees.size());
		TreeNode tree = trees.get(0);
		assertTrue(tree.isUnlabeledBracket());
		assertNull(tree.getLabel());

		TreeNode s = tree.unwrap();
		assertTrue(s.isNonTerminal());
		assertEquals("S", s.getLabel());
		assertEquals(5, s.getChildren().size());

		NonTerminal topic = (NonTerminal)s.getChildren().get(0);
		assertEquals("S", topic.getSymbol().getLabel());
		assertEquals("TPC", topic.getSymbol().getTags().get(0));
		assertEquals("1", topic.getSymbol().getCoindex());

		Terminal comma = (Terminal)s.getChildren().get(1);
		assertEquals(",", comma.getTag());
		assertEquals(",", comma.getWord());
	}

	@Test
	public void testToStringIsCanonical() {
		String text = "(S (NP-SBJ (NNP Ms.) (NNP Haag)) (VP (VBZ plays) (NP (NNP Elianti))) (. .))";
		assertEquals(text, PennTreebankReader.parse(text).get(0).toString());
		// the unlabeled bracket prints as its child
		assertEquals(text, PennTreebankReader.parse("(  " + text + "\n)").get(0).toString());
	}

	@Test
	public void testTagComesBeforeWord() {
		TreeNode tree = PennTreebankReader.parse("(NN dog)").get(0);
		assertTrue(tree.isTerminal());
		assertEquals("NN", ((Terminal)tree).getTag());
		assertEquals("dog", ((Terminal)tree).getWord());
	}

	@Test
	public void testTreesSeparatedByBracketsOnly() {
		List<TreeNode> trees = PennTreebankReader.parse("(A (B b))(C (D d))\n(E\n (F f)\n)");
		assertEquals(3, trees.size());
		assertEquals("(C (D d))", trees.get(1).toString());
		assertEquals("(E (F f))", trees.get(2).toString());
	}

	@Test
	public void testEmptyInput() {
		assertTrue(PennTreebankReader.parse("").isEmpty());
		assertTrue(PennTreebankReader.parse(" \n\n ").isEmpty());
	}

	@Test
	public void testStrayCloseBracket() throws IOException {
		PennTreebankReader reader = reader(") (S (NN a))");
		try {
			reader.readTree();
			fail("Expected unbalanced brackets");
		} catch(UnbalancedParenthesesException ex) {
			assertEquals(1, ex.getLine());
			assertEquals(1, ex.getColumn());
		}
		assertNull(reader.readTree());
	}

	@Test
	public void testExtraCloseBracketAfterTree() throws IOException {
		PennTreebankReader reader = reader("(S (NP (NN a))))");
		assertEquals("(S (NP (NN a)))", reader.readTree().toString());
		try {
			reader.readTree();
			fail("Expected unbalanced brackets");
		} catch(UnbalancedParenthesesException ex) {
			assertEquals(16, ex.getColumn());
		}
	}

	@Test
	public void testUnclosedBracket() throws IOException {
		PennTreebankReader reader = reader("(S (NP (NN a))");
		try {
			reader.readTree();
			fail("Expected unbalanced brackets");
		} catch(UnbalancedParenthesesException ex) {
			assertEquals(1, ex.getLine());
			assertEquals(1, ex.getColumn());
		}
		assertNull(reader.readTree());
	}

	@Test
	public void testMalformedLabelSkipsOneTree() throws IOException {
		PennTreebankReader reader = reader("(1X (NN a))\n(S (NN b))");
		try {
			reader.readTree();
			fail("Expected malformed label");
		} catch(MalformedLabelException ex) {
			assertEquals("1X", ex.getLabel());
			assertEquals(1, ex.getLine());
			assertEquals(2, ex.getColumn());
		}
		assertEquals("(S (NN b))", reader.readTree().toString());
		assertNull(reader.readTree());
		assertEquals(2, reader.getTreeCount());
	}

	@Test
	public void testAtomOutsideBrackets() throws IOException {
		PennTreebankReader reader = reader("word (S (NN a))");
		try {
			reader.readTree();
			fail("Expected format error");
		} catch(UnbalancedParenthesesException ex) {
			fail("Not a bracket problem");
		} catch(TreebankFormatException ex) {
			assertEquals(1, ex.getColumn());
		}
		assertEquals("(S (NN a))", reader.readTree().toString());
	}

	@Test
	public void testStructuralErrors() throws IOException {
		String[] bad = {"()", "(NP)", "((S (NN a)) (S (NN b)))", "(NP (NN a) b)", "(NP a b)"};
		for(String text : bad) {
			PennTreebankReader reader = reader(text + " (S (NN ok))");
			try {
				reader.readTree();
				fail("Expected " + text + " to be rejected");
			} catch(TreebankFormatException ex) {
				assertFalse(ex instanceof UnbalancedParenthesesException);
			}
			assertEquals("(S (NN ok))", reader.readTree().toString());
		}
	}

	@Test
	public void testIterator() throws IOException {
		int count = 0;
		for(TreeNode tree : reader("(A (B b)) (C (D d)) (E (F f))")) {
			assertTrue(tree.isNonTerminal());
			count++;
		}
		assertEquals(3, count);
	}

	@Test
	public void testReadFile() throws Exception {
		File file = new File(getClass().getResource("/wsj_sample.mrg").toURI());
		PennTreebankReader reader = new PennTreebankReader(file);
		List<TreeNode> trees = reader.readAllTrees();
		reader.close();
		assertEquals(3, trees.size());
		assertEquals("(S (NP-SBJ (NNP Ms.) (NNP Haag)) (VP (VBZ plays) (NP (NNP Elianti))) (. .))", trees.get(1).toString());
	}
}
