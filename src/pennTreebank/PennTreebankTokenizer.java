package pennTreebank;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Splits bracketed text into open bracket, close bracket and atom tokens.
 * Whitespace only separates tokens.  Reads the underlying reader one character at a time.
 */
public class PennTreebankTokenizer implements Closeable {

	private final Reader reader;
	private int currentChar;

	// position of currentChar, 1-based
	private int line = 1;
	private int column = 1;

	public PennTreebankTokenizer(Reader reader) throws IOException {
		this.reader = reader;
		currentChar = reader.read();
	}

	public PennTreebankTokenizer(String text) throws IOException {
		this(new StringReader(text));
	}

	private void advance() throws IOException {
		if(currentChar == '\n') {
			line++;
			column = 1;
		}
		else {
			column++;
		}
		currentChar = reader.read();
	}

	private static boolean isBracket(int c) {
		return c == '(' || c == ')';
	}

	/**
	 * @return the next token, or null if the end of the input has been reached
	 * @throws IOException
	 */
	public Token nextToken() throws IOException {
		while(currentChar != -1 && Character.isWhitespace(currentChar)) {
			advance();
		}
		if(currentChar == -1)
			return null;

		int startLine = line;
		int startColumn = column;
		if(isBracket(currentChar)) {
			Token.Type type = currentChar == '(' ? Token.Type.OPEN : Token.Type.CLOSE;
			String text = Character.toString((char) currentChar);
			advance();
			return new Token(type, text, startLine, startColumn);
		}

		StringBuilder sb = new StringBuilder();
		while(currentChar != -1
				&& !isBracket(currentChar)
				&& !Character.isWhitespace(currentChar)) {
			sb.append((char) currentChar);
			advance();
		}
		return new Token(Token.Type.ATOM, sb.toString(), startLine, startColumn);
	}

	@Override
	public void close() throws IOException {
		reader.close();
	}
}
