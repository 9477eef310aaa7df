package pennTreebank;
import java.util.Collections;
import java.util.List;

/**
 * What is left of a tree after every element has been removed.  Callers must check
 * {@link TreeNode#isEmptyTree()}; it has no terminals, no spans and prints as an empty string.
 */
public final class EmptyTree extends TreeNode {
	public static final EmptyTree INSTANCE = new EmptyTree();

	private EmptyTree() {
	}

	@Override
	public boolean isEmptyTree() {
		return true;
	}

	@Override
	public List<TreeNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String getLabel() {
		return null;
	}

	@Override
	public String toString() {
		return "";
	}
}
