package pennTreebank;
import java.util.List;

/**
 * Depth first, left to right walk of a tree.  Every transform and query is a {@link TreeVisitor}
 * run through here.  Unlabeled brackets are transparent: the visitor only sees their child.
 * The empty tree is never passed to the visitor.
 */
public class TreeTraversal {
	private TreeTraversal() {
	}

	/**
	 * @param node
	 * @param visitor
	 * @param initialState
	 * @return the state returned by the visitor's post call on node
	 */
	public static <S> S traverse(TreeNode node, TreeVisitor<S> visitor, S initialState) {
		if(node.isEmptyTree())
			return initialState;
		if(node.isUnlabeledBracket())
			return traverse(((UnlabeledBracket)node).getChild(), visitor, initialState);

		S state = visitor.pre(node, initialState);
		List<TreeNode> children = node.getChildren();
		for(int i = 0; i < children.size(); i++) {
			state = traverse(children.get(i), visitor, state);
		}
		return visitor.post(node, state);
	}
}
