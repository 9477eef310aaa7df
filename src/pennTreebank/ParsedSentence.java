package pennTreebank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Contains a parse tree and the terminals of the sentence it covers.
 * Word positions count only terminals that are not -NONE-, matching the positions of {@link Span}s.
 */
public class ParsedSentence {
	private final TreeNode tree;
	private final List<Terminal> terminals;
	private final List<Terminal> words = new ArrayList<>();

	public ParsedSentence(TreeNode tree) {
		this.tree = tree;
		this.terminals = Collections.unmodifiableList(tree.getTerminals(true));
		for(Terminal terminal : terminals) {
			if(!terminal.isNone())
				words.add(terminal);
		}
	}

	public TreeNode getTree() {
		return tree;
	}

	/**
	 * @return every terminal including -NONE- ones
	 */
	public List<Terminal> getTerminals() {
		return terminals;
	}

	/**
	 * Number of words, not counting empty elements
	 */
	public int size() {
		return words.size();
	}

	public String getWord(int position) {
		return words.get(position).getWord();
	}

	public String getTag(int position) {
		return words.get(position).getTag();
	}

	/**
	 * Note: spans are recomputed from the tree, so they reflect any transforms applied since construction
	 */
	public List<Span> getSpans() {
		return SpanUtilities.allSpans(tree);
	}

	public String toString() {
		return "Sentence: " + words + " " + tree;
	}
}
