package pennTreebank;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;

import org.junit.Test;

public class MainTests {

	private String output;

	private int run(String input, String... args) throws IOException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, "UTF-8");
		PennTreebankReader reader = new PennTreebankReader(new StringReader(input));
		try {
			return new Main(new TreebankOptions(args), out).run(reader, "test.mrg");
		} finally {
			reader.close();
			output = bytes.toString("UTF-8").replace("\r\n", "\n");
		}
	}

	@Test
	public void testOptions() {
		TreebankOptions options = new TreebankOptions(new String[] {"-c", "spans", "-e", "-s", "-a", "-n", "wsj.mrg"});
		assertEquals("spans", options.command);
		assertEquals("wsj.mrg", options.inputFile);
		assertTrue(options.removeEmpty);
		assertTrue(options.simplify);
		assertTrue(options.includeNulls);
		assertFalse(options.diagram);
		assertEquals("ROOT", options.rootLabel);

		options = new TreebankOptions(new String[] {"-r", "TOP", "-f", "other.mrg"});
		assertEquals("transform", options.command);
		assertEquals("other.mrg", options.inputFile);
		assertEquals("TOP", options.rootLabel);
		assertFalse(options.removeEmpty);

		options = new TreebankOptions(new String[0]);
		assertNull(options.inputFile);
		assertNull(options.rootLabel);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownCommand() {
		new TreebankOptions(new String[] {"-c", "evalb"});
	}

	@Test(expected = MalformedLabelException.class)
	public void testBadRootLabel() {
		new TreebankOptions(new String[] {"-r", "1X"});
	}

	@Test(expected = MalformedLabelException.class)
	public void testRootLabelMustPrintUnchanged() {
		new TreebankOptions(new String[] {"-r", "S1"});
	}

	@Test
	public void testTransform() throws IOException {
		assertEquals(0, run(PennTreebankReaderTests.FIXTURE, "-e", "-s", "-a"));
		assertEquals("(ROOT (S (S (NP (PRP xx)) (ADVP (RB xx)) (VP (VBZ xx) (NP (DT xx) (NN xx) (NN xx)))) (, ,) (NP (NNS xx)) (VP (VBP xx)) (. .)))\n\n", output);
	}

	@Test
	public void testSkipsBadTrees() throws IOException {
		assertEquals(1, run("(1X (NN a)) (S (NN b)) (S (NP (-NONE- *)))", "-e"));
		assertEquals("(S (NN b))\n\n", output);
	}

	@Test
	public void testSkipsAtomOutsideTree() throws IOException {
		assertEquals(1, run("word (S (NN a))"));
		assertEquals("(S (NN a))\n\n", output);
	}

	@Test
	public void testWritesUtf8() throws IOException {
		run("(NN café) (NP (NNP Zürich))");
		assertEquals("(NN café)\n\n(NP (NNP Zürich))\n\n", output);
	}

	@Test
	public void testUnbalancedStopsRun() throws IOException {
		try {
			run("(S (NN a)) (S (NN b)", "-c", "transform");
			fail("Expected unbalanced brackets");
		} catch(UnbalancedParenthesesException ex) {
			assertEquals(12, ex.getColumn());
		}
	}

	@Test
	public void testSpans() throws IOException {
		run("( (S (NP-SBJ (-NONE- *)) (VP (VBD ran))) )", "-c", "spans");
		assertEquals("NP-SBJ 0 0\n-NONE- 0 0\nS 0 1\nVP 0 1\nVBD 0 1\n\n", output);

		run("(S (NP (NN a)) (VP (VB b)))", "-c", "spans", "-d");
		assertEquals("<S      >-------->\n<NP     ><VP     >\n<NN     ><VB     >\n\n", output);
	}

	@Test
	public void testIndex() throws IOException {
		run("( (S (NN a) (-NONE- *) (NN b)) )\n(S (NN c))", "-c", "index");
		assertEquals("test.mrg|0|2|(S (NN a) (-NONE- *) (NN b))\ntest.mrg|1|1|(S (NN c))\n", output);
	}

	@Test
	public void testStructure() throws IOException {
		run("( (S-1 (NP-SBJ-2 (NNP Ms.) (NNP Haag)) (VP=3-4 (VBZ plays)) (. .)) )", "-c", "structure");
		assertEquals("S-1 => NP-SBJ VP=3 ./.\n", output);
	}

	@Test
	public void testTerminals() throws IOException {
		run("(S (NP (-NONE- *)) (NN a))", "-c", "terminals");
		assertEquals("----\na/NN\n----\n", output);

		run("(S (NP (-NONE- *)) (NN a))", "-c", "terminals", "-n");
		assertEquals("----\n*/-NONE-\na/NN\n----\n", output);
	}
}
