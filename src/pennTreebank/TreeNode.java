package pennTreebank;
import java.util.ArrayList;
import java.util.List;

/**
 * A node of a parse tree read from bracketed text.  A node is a {@link Terminal} (tag and word),
 * a {@link NonTerminal} (symbol and children), an {@link UnlabeledBracket} wrapping exactly one
 * child, or the {@link EmptyTree} left over when every element of a tree was removed.
 * Each node exclusively owns its children.
 */
public abstract class TreeNode {
	public static final String NONE_TAG = "-NONE-";

	public boolean isTerminal() {
		return false;
	}

	public boolean isNonTerminal() {
		return false;
	}

	public boolean isUnlabeledBracket() {
		return false;
	}

	public boolean isEmptyTree() {
		return false;
	}

	/**
	 * Note: for a NonTerminal editing the result will mutate the tree
	 * @return children in order, empty for terminals
	 */
	public abstract List<TreeNode> getChildren();

	/**
	 * @return the label used for spans: the tag of a terminal, the full symbol of a non-terminal,
	 * or null for nodes without a label of their own
	 */
	public abstract String getLabel();

	/**
	 * @return this node with any unlabeled brackets around it removed
	 */
	public TreeNode unwrap() {
		return this;
	}

	/**
	 * @param includeNulls whether -NONE- terminals are included
	 * @return terminals in left to right order
	 */
	public List<Terminal> getTerminals(final boolean includeNulls) {
		return TreeTraversal.traverse(this, new TreeVisitor<List<Terminal>>() {
			@Override
			public List<Terminal> post(TreeNode node, List<Terminal> terminals) {
				if(node.isTerminal()) {
					Terminal terminal = (Terminal)node;
					if(includeNulls || !terminal.isNone())
						terminals.add(terminal);
				}
				return terminals;
			}
		}, new ArrayList<Terminal>());
	}

	public List<String> getAllWords() {
		List<String> result = new ArrayList<>();
		for(Terminal terminal : getTerminals(false)) {
			result.add(terminal.getWord());
		}
		return result;
	}

	/**
	 * Bracketed form, (LABEL child ...) for constituents and (TAG word) for terminals
	 */
	public abstract String toString();
}
