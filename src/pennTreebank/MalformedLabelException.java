package pennTreebank;

/**
 * A constituent label that does not decode into a {@link Symbol}.
 */
public class MalformedLabelException extends TreebankFormatException {
	private static final long serialVersionUID = 1L;

	private final String label;
	private final String reason;

	public MalformedLabelException(String label, String reason) {
		super("Malformed label [" + label + "]: " + reason);
		this.label = label;
		this.reason = reason;
	}

	public MalformedLabelException(String label, String reason, Token token) {
		super("Malformed label [" + label + "]: " + reason, token);
		this.label = label;
		this.reason = reason;
	}

	public String getLabel() {
		return label;
	}

	public String getReason() {
		return reason;
	}
}
