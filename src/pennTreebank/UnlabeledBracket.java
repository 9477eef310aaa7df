package pennTreebank;
import java.util.Collections;
import java.util.List;

/**
 * A bracket without a label around exactly one child, as in the ( (S ...) ) convention
 * that wraps each sentence of the Penn Treebank.  It has no span and prints as its child.
 */
public class UnlabeledBracket extends TreeNode {
	private final TreeNode child;

	public UnlabeledBracket(TreeNode child) {
		this.child = child;
	}

	@Override
	public boolean isUnlabeledBracket() {
		return true;
	}

	public TreeNode getChild() {
		return child;
	}

	@Override
	public List<TreeNode> getChildren() {
		return Collections.singletonList(child);
	}

	@Override
	public String getLabel() {
		return null;
	}

	@Override
	public TreeNode unwrap() {
		return child.unwrap();
	}

	@Override
	public String toString() {
		return child.toString();
	}

	public int hashCode() {
		return 71 + child.hashCode();
	}

	public boolean equals(Object other) {
		return other instanceof UnlabeledBracket && ((UnlabeledBracket)other).child.equals(child);
	}
}
