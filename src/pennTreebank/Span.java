package pennTreebank;

/**
 * The half open range of terminal positions [start, end) covered by one node of a tree.
 * A span with start == end covers no words: an empty element, or a constituent made only of empty elements.
 */
public class Span {
	private final String label;
	private final int start;
	private final int end;

	public Span(String label, int start, int end) {
		if(start < 0 || end < start)
			throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
		this.label = label;
		this.start = start;
		this.end = end;
	}

	public String getLabel() {
		return label;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int getLength() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}

	/**
	 * @return true if other lies within this span
	 */
	public boolean contains(Span other) {
		return start <= other.start && other.end <= end;
	}

	public String toString() {
		return "Span: " + label + " " + start + " " + end;
	}

	public boolean equals(Object other) {
		if(other instanceof Span) {
			Span otherSpan = (Span)other;
			return otherSpan.start == start && otherSpan.end == end && otherSpan.label.equals(label);
		}
		return false;
	}

	public int hashCode() {
		return start * 17 + end * 19 + 3 * label.hashCode();
	}
}
