package pennTreebank;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads trees in Penn Treebank bracketing, one per balanced top level bracket group.
 * Trees may span several lines and several trees may share a line.
 * <p>
 * A whole group is read before the tree is built, so an error inside one tree leaves the reader
 * at the start of the next group.  An unbalanced bracket ends the stream.
 */
public class PennTreebankReader implements Closeable, Iterable<TreeNode> {
	private static final Logger logger = LoggerFactory.getLogger(PennTreebankReader.class);

	private final PennTreebankTokenizer tokenizer;
	private int treeCount = 0;
	private boolean finished = false;

	public PennTreebankReader(Reader reader) throws IOException {
		this.tokenizer = new PennTreebankTokenizer(reader);
	}

	public PennTreebankReader(File file) throws IOException {
		this(new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)));
	}

	public PennTreebankReader(String filename) throws IOException {
		this(new File(filename));
	}

	/**
	 * Reads every tree in text
	 * @param text
	 * @return
	 */
	public static List<TreeNode> parse(String text) {
		try(PennTreebankReader reader = new PennTreebankReader(new StringReader(text))) {
			return reader.readAllTrees();
		} catch(IOException ex) {
			throw new UncheckedIOException(ex);
		}
	}

	/**
	 * Read a single ptb tree.
	 *
	 * @return a ptb tree, or null if the end of the stream has been reached.
	 * @throws IOException
	 * @throws UnbalancedParenthesesException if brackets don't match, after which the reader is finished
	 * @throws MalformedLabelException if a constituent label can't be decoded
	 * @throws TreebankFormatException for other problems inside one tree
	 */
	public TreeNode readTree() throws IOException {
		if(finished)
			return null;

		Token first = tokenizer.nextToken();
		if(first == null) {
			finished = true;
			logger.debug("Read {} trees, done.", treeCount);
			return null;
		}
		if(first.isClose()) {
			finished = true;
			throw new UnbalancedParenthesesException("too much [)]", first.getLine(), first.getColumn());
		}
		if(first.isAtom()) {
			throw new TreebankFormatException("expecting [(] but found [" + first.getText() + "] outside of a tree", first);
		}

		List<Token> group = readGroup(first);
		int index = treeCount++;
		logger.debug("Reading tree {} at line {}", index, first.getLine());
		return build(group);
	}

	public List<TreeNode> readAllTrees() throws IOException {
		List<TreeNode> trees = new ArrayList<>();
		TreeNode tree;
		while((tree = readTree()) != null) {
			trees.add(tree);
		}
		return trees;
	}

	/**
	 * @return the number of bracket groups read so far, including ones that failed to build
	 */
	public int getTreeCount() {
		return treeCount;
	}

	private List<Token> readGroup(Token open) throws IOException {
		List<Token> group = new ArrayList<>();
		Deque<Token> opens = new ArrayDeque<>();
		group.add(open);
		opens.push(open);
		while(!opens.isEmpty()) {
			Token token = tokenizer.nextToken();
			if(token == null) {
				finished = true;
				Token unclosed = opens.peek();
				throw new UnbalancedParenthesesException("[(] is never closed", unclosed.getLine(), unclosed.getColumn());
			}
			if(token.isOpen())
				opens.push(token);
			else if(token.isClose())
				opens.pop();
			group.add(token);
		}
		return group;
	}

	/**
	 * Shift atoms and brackets onto a stack, reducing at every close bracket.
	 * Stack entries are Tokens (open brackets and atoms) or finished TreeNodes.
	 */
	private TreeNode build(List<Token> group) {
		Deque<Object> stack = new ArrayDeque<>();
		for(Token token : group) {
			if(token.isClose())
				stack.push(reduce(stack));
			else
				stack.push(token);
		}
		return (TreeNode)stack.pop();
	}

	private static boolean isAtom(Object item) {
		return item instanceof Token && ((Token)item).isAtom();
	}

	private TreeNode reduce(Deque<Object> stack) {
		LinkedList<Object> items = new LinkedList<>();
		while(!(stack.peek() instanceof Token && ((Token)stack.peek()).isOpen())) {
			items.addFirst(stack.pop());
		}
		Token open = (Token)stack.pop();

		if(items.isEmpty())
			throw new TreebankFormatException("empty brackets", open);

		// (TAG word)
		if(items.size() == 2 && isAtom(items.get(0)) && isAtom(items.get(1)))
			return new Terminal(((Token)items.get(0)).getText(), ((Token)items.get(1)).getText());

		if(isAtom(items.getFirst())) {
			Token labelToken = (Token)items.removeFirst();
			Symbol symbol;
			try {
				symbol = Symbol.parse(labelToken.getText());
			} catch(MalformedLabelException ex) {
				throw new MalformedLabelException(labelToken.getText(), ex.getReason(), labelToken);
			}
			if(items.isEmpty())
				throw new TreebankFormatException("constituent [" + labelToken.getText() + "] has no children", open);

			List<TreeNode> children = new ArrayList<>();
			for(Object item : items) {
				checkNotAtom(item, labelToken.getText());
				children.add((TreeNode)item);
			}
			return new NonTerminal(symbol, children);
		}

		for(Object item : items) {
			checkNotAtom(item, null);
		}
		if(items.size() > 1)
			throw new TreebankFormatException("bracket without a label has " + items.size() + " children", open);
		return new UnlabeledBracket((TreeNode)items.getFirst());
	}

	private static void checkNotAtom(Object item, String parentLabel) {
		if(isAtom(item)) {
			Token token = (Token)item;
			String where = parentLabel == null ? "an unlabeled bracket" : "[" + parentLabel + "]";
			throw new TreebankFormatException("unexpected word [" + token.getText() + "] among the children of " + where, token);
		}
	}

	/**
	 * Single pass iteration over the remaining trees.  IOExceptions are rethrown as UncheckedIOException.
	 */
	@Override
	public Iterator<TreeNode> iterator() {
		return new Iterator<TreeNode>() {
			private TreeNode next;

			@Override
			public boolean hasNext() {
				if(next == null) {
					try {
						next = readTree();
					} catch(IOException ex) {
						throw new UncheckedIOException(ex);
					}
				}
				return next != null;
			}

			@Override
			public TreeNode next() {
				if(!hasNext())
					throw new NoSuchElementException();
				TreeNode result = next;
				next = null;
				return result;
			}
		};
	}

	@Override
	public void close() throws IOException {
		tokenizer.close();
	}
}
