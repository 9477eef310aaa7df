package pennTreebank;

/**
 * Callbacks for {@link TreeTraversal#traverse}.  Both default to passing the state through unchanged.
 * @param <S> the state threaded through the traversal
 */
public abstract class TreeVisitor<S> {
	/**
	 * Called before the children of node are visited
	 * @return the state handed to the first child
	 */
	public S pre(TreeNode node, S state) {
		return state;
	}

	/**
	 * Called after every child of node has been visited
	 * @param state the state returned by the last child, or by pre if there are no children
	 * @return the state handed to the next sibling
	 */
	public S post(TreeNode node, S state) {
		return state;
	}
}
