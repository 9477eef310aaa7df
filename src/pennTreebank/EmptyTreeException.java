package pennTreebank;

/**
 * Thrown when an operation that needs a real tree is given {@link EmptyTree#INSTANCE}.
 */
public class EmptyTreeException extends IllegalStateException {
	private static final long serialVersionUID = 1L;

	public EmptyTreeException(String operation) {
		super("Cannot " + operation + ": every element of the tree was empty");
	}
}
