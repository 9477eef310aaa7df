package pennTreebank;
import java.util.Collections;
import java.util.List;

/**
 * A leaf: a word with its part of speech tag.  Tag -NONE- marks an empty element such as a trace.
 */
public class Terminal extends TreeNode {
	private final String word;
	private final String tag;

	public Terminal(String tag, String word) {
		this.tag = tag;
		this.word = word;
	}

	@Override
	public boolean isTerminal() {
		return true;
	}

	public String getWord() {
		return word;
	}

	public String getTag() {
		return tag;
	}

	/**
	 * @return true if this is an empty element
	 */
	public boolean isNone() {
		return NONE_TAG.equals(tag);
	}

	@Override
	public List<TreeNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String getLabel() {
		return tag;
	}

	@Override
	public String toString() {
		return "(" + tag + " " + word + ")";
	}

	public int hashCode() {
		return 37 + word.hashCode() + 3 * tag.hashCode();
	}

	public boolean equals(Object other) {
		if(!(other instanceof Terminal))
			return false;
		Terminal o = (Terminal)other;
		return o.tag.equals(tag) && o.word.equals(word);
	}
}
