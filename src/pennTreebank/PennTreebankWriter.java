package pennTreebank;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes trees in bracketed form, each followed by a blank line.
 */
public class PennTreebankWriter implements Closeable {
	private final Writer writer;

	// null to write trees unchanged
	private final String rootLabel;

	public PennTreebankWriter(Writer writer) {
		this(writer, null);
	}

	/**
	 * @param writer
	 * @param rootLabel if not null every tree is put under a root with this label before writing,
	 * see {@link TreeTransforms#addRoot(TreeNode, String)}
	 */
	public PennTreebankWriter(Writer writer, String rootLabel) {
		this.writer = writer;
		this.rootLabel = rootLabel;
	}

	/**
	 * @param tree
	 * @throws IOException
	 * @throws EmptyTreeException if tree is the empty tree
	 */
	public void writeTree(TreeNode tree) throws IOException {
		if(tree.isEmptyTree())
			throw new EmptyTreeException("write a tree");
		if(rootLabel != null)
			tree = TreeTransforms.addRoot(tree, rootLabel);

		writer.append(tree.toString());
		writer.append('\n');
		writer.append('\n');
	}

	public void flush() throws IOException {
		writer.flush();
	}

	@Override
	public void close() throws IOException {
		writer.close();
	}
}
