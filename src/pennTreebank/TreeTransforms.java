package pennTreebank;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;

/**
 * Structural rewrites of parse trees.  Each works on the tree in place and returns the resulting root.
 */
public class TreeTransforms {
	public static final String DEFAULT_ROOT_LABEL = "ROOT";

	// labels treated as an existing dummy root
	static final HashSet<String> rootLabels = new HashSet<>(Arrays.asList("ROOT", "TOP"));

	private TreeTransforms() {
	}

	private static final TreeVisitor<Void> removeEmpty = new TreeVisitor<Void>() {
		@Override
		public Void post(TreeNode node, Void state) {
			if(node.isNonTerminal()) {
				Iterator<TreeNode> it = node.getChildren().iterator();
				while(it.hasNext()) {
					if(isRemoved(it.next()))
						it.remove();
				}
			}
			return state;
		}
	};

	private static final TreeVisitor<Void> simplify = new TreeVisitor<Void>() {
		@Override
		public Void pre(TreeNode node, Void state) {
			if(node.isNonTerminal()) {
				NonTerminal nonTerminal = (NonTerminal)node;
				nonTerminal.setSymbol(nonTerminal.getSymbol().simplify());
			}
			return state;
		}
	};

	/**
	 * A node is removed when it is a -NONE- terminal or all of its children were removed
	 */
	private static boolean isRemoved(TreeNode node) {
		if(node.isTerminal())
			return ((Terminal)node).isNone();
		if(node.isUnlabeledBracket())
			return isRemoved(((UnlabeledBracket)node).getChild());
		return node.getChildren().isEmpty();
	}

	/**
	 * Deletes -NONE- terminals, and any constituent left without children.  Surviving siblings keep their order.
	 * @param tree
	 * @return tree, or {@link EmptyTree#INSTANCE} if nothing is left
	 */
	public static TreeNode removeEmptyElements(TreeNode tree) {
		if(tree.isEmptyTree())
			return tree;
		TreeTraversal.traverse(tree, removeEmpty, null);
		if(isRemoved(tree))
			return EmptyTree.INSTANCE;
		return tree;
	}

	/**
	 * Strips function tags, coindices and gap indices from every non-terminal.  Terminal tags are untouched.
	 * @param tree
	 * @return tree
	 */
	public static TreeNode simplifyLabels(TreeNode tree) {
		TreeTraversal.traverse(tree, simplify, null);
		return tree;
	}

	public static TreeNode addRoot(TreeNode tree) {
		return addRoot(tree, DEFAULT_ROOT_LABEL);
	}

	/**
	 * Puts the tree under a root labelled rootLabel.  Unlabeled brackets around the tree are dropped first.
	 * If the top constituent is already labelled ROOT or TOP it is relabelled instead.
	 * @param tree
	 * @param rootLabel every character must belong to the label, a tag or an index
	 * @return the new root
	 * @throws EmptyTreeException if tree is the empty tree
	 * @throws MalformedLabelException if rootLabel would not print back unchanged
	 */
	public static TreeNode addRoot(TreeNode tree, String rootLabel) {
		if(tree.isEmptyTree())
			throw new EmptyTreeException("add a root");
		Symbol rootSymbol = Symbol.parseExact(rootLabel);

		TreeNode top = tree.unwrap();
		if(top.isNonTerminal()) {
			NonTerminal nonTerminal = (NonTerminal)top;
			if(rootLabels.contains(nonTerminal.getSymbol().getLabel())) {
				nonTerminal.setSymbol(nonTerminal.getSymbol().withLabel(rootSymbol.getLabel()));
				return nonTerminal;
			}
		}
		return new NonTerminal(rootSymbol, top);
	}
}
