package pennTreebank;

/**
 * Thrown when bracketed input cannot be read as a tree.
 * Line and column are 1-based, or -1 when the position is not known.
 */
public class TreebankFormatException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	private final int line;
	private final int column;

	public TreebankFormatException(String message) {
		this(message, -1, -1);
	}

	public TreebankFormatException(String message, int line, int column) {
		super(line < 0 ? message : message + " at line " + line + ", column " + column);
		this.line = line;
		this.column = column;
	}

	public TreebankFormatException(String message, Token token) {
		this(message, token.getLine(), token.getColumn());
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}
}
