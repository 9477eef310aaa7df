package pennTreebank;

/**
 * A stray close bracket, or an open bracket that is never closed.  Ends the input stream.
 */
public class UnbalancedParenthesesException extends TreebankFormatException {
	private static final long serialVersionUID = 1L;

	public UnbalancedParenthesesException(String message, int line, int column) {
		super(message, line, column);
	}
}
