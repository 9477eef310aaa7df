package pennTreebank;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import joptsimple.OptionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: reads a treebank file (or standard input), applies the requested
 * transforms and prints trees, spans, a sentence index, top level structure or terminals.
 */
public class Main {
	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	private final TreebankOptions options;
	private final PrintStream out;

	public Main(TreebankOptions options, PrintStream out) {
		this.options = options;
		this.out = out;
	}

	public static void main(String[] args) throws Exception {
		TreebankOptions options;
		try {
			options = new TreebankOptions(args);
		} catch(OptionException | IllegalArgumentException ex) {
			System.err.println(ex.getMessage());
			System.err.println(TreebankOptions.usage());
			System.exit(2);
			return;
		}

		String name = options.inputFile == null ? "<stdin>" : options.inputFile;
		int failed;
		try(PennTreebankReader reader = options.inputFile == null
				? new PennTreebankReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))
				: new PennTreebankReader(options.inputFile)) {
			failed = new Main(options, new PrintStream(System.out, true, "UTF-8")).run(reader, name);
		} catch(UnbalancedParenthesesException ex) {
			System.out.flush();
			logger.error("Error while processing file {}: {}", name, ex.getMessage());
			System.exit(1);
			return;
		}
		if(failed > 0)
			System.exit(1);
	}

	/**
	 * Processes every tree from reader.  Trees that fail to read are logged and skipped.
	 * @param reader
	 * @param name file name used in messages and the sentence index
	 * @return the number of trees skipped because of errors
	 * @throws IOException
	 * @throws UnbalancedParenthesesException if the brackets of the input don't match
	 */
	public int run(PennTreebankReader reader, String name) throws IOException {
		PennTreebankWriter writer = new PennTreebankWriter(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8)));
		int failed = 0;
		int processed = 0;
		while(true) {
			TreeNode tree;
			try {
				tree = reader.readTree();
			} catch(UnbalancedParenthesesException ex) {
				throw ex;
			} catch(TreebankFormatException ex) {
				logger.warn("{}: skipping malformed input: {}", name, ex.getMessage());
				failed++;
				continue;
			}
			if(tree == null)
				break;

			int sentence = reader.getTreeCount() - 1;
			if(options.command.equals("index")) {
				printIndexEntry(name, sentence, tree);
				processed++;
				continue;
			}

			tree = applyTransforms(tree);
			if(tree.isEmptyTree()) {
				logger.warn("{}: tree {} has nothing left after removing empty elements, skipped", name, sentence);
				continue;
			}

			if(options.command.equals("transform")) {
				writer.writeTree(tree);
			}
			else if(options.command.equals("spans")) {
				printSpans(tree);
			}
			else if(options.command.equals("structure")) {
				printStructure(name, sentence, tree);
			}
			else if(options.command.equals("terminals")) {
				printTerminals(tree);
			}
			processed++;
		}
		writer.flush();
		out.flush();
		logger.info("{}: processed {} trees, {} skipped", name, processed, failed);
		return failed;
	}

	TreeNode applyTransforms(TreeNode tree) {
		if(options.removeEmpty) {
			tree = TreeTransforms.removeEmptyElements(tree);
			if(tree.isEmptyTree())
				return tree;
		}
		if(options.simplify)
			tree = TreeTransforms.simplifyLabels(tree);
		if(options.rootLabel != null)
			tree = TreeTransforms.addRoot(tree, options.rootLabel);
		return tree;
	}

	/**
	 * file|sentence|number of words|tree
	 */
	void printIndexEntry(String name, int sentence, TreeNode tree) {
		ParsedSentence parsed = new ParsedSentence(tree);
		out.println(name + "|" + sentence + "|" + parsed.size() + "|" + tree);
	}

	void printSpans(TreeNode tree) {
		List<Span> spans = SpanUtilities.allSpans(tree);
		if(options.diagram) {
			SpanUtilities.printSpans(spans, new ParsedSentence(tree).size(), out);
		}
		else {
			for(Span span : spans) {
				out.println(span.getLabel() + " " + span.getStart() + " " + span.getEnd());
			}
		}
		out.println();
	}

	/**
	 * LABEL => child child ... with terminals as word/tag and constituents without their coindex
	 */
	void printStructure(String name, int sentence, TreeNode tree) {
		TreeNode top = tree.unwrap();
		if(!top.isNonTerminal()) {
			logger.warn("{}: tree {} is a single terminal, no structure to print", name, sentence);
			return;
		}
		StringBuilder line = new StringBuilder(top.getLabel());
		line.append(" =>");
		for(TreeNode child : top.getChildren()) {
			line.append(' ');
			TreeNode c = child.unwrap();
			if(c.isTerminal()) {
				Terminal terminal = (Terminal)c;
				line.append(terminal.getWord()).append('/').append(terminal.getTag());
			}
			else {
				line.append(((NonTerminal)c).getSymbol().withoutCoindex());
			}
		}
		out.println(line);
	}

	void printTerminals(TreeNode tree) {
		out.println("----");
		for(Terminal terminal : tree.getTerminals(options.includeNulls)) {
			out.println(terminal.getWord() + "/" + terminal.getTag());
		}
		out.println("----");
	}
}
