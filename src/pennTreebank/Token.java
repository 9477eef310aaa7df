package pennTreebank;

/**
 * A single token of bracketed treebank text.  Tokens only live for the duration of one read.
 */
public class Token {
	public enum Type {
		OPEN, // (
		CLOSE, // )
		ATOM // any other run of non-whitespace characters
	}

	private final Type type;
	private final String text;
	private final int line;
	private final int column;

	public Token(Type type, String text, int line, int column) {
		this.type = type;
		this.text = text;
		this.line = line;
		this.column = column;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the characters of an atom, or the bracket itself for OPEN and CLOSE
	 */
	public String getText() {
		return text;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	public boolean isOpen() {
		return type == Type.OPEN;
	}

	public boolean isClose() {
		return type == Type.CLOSE;
	}

	public boolean isAtom() {
		return type == Type.ATOM;
	}

	public String toString() {
		return "Token:'" + text + "':" + line + ":" + column;
	}
}
