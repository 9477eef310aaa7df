package pennTreebank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A decoded constituent label such as NP-SBJ-1 or WHNP=3.
 * The bare label is followed by any number of function tags, an optional gap index (written =N)
 * and an optional coindex (written -N).  Symbols are immutable.
 * A decoded symbol prints as the atom it came from; equality only compares the decoded parts.
 */
public class Symbol {
	// characters that can't appear in a label or tag
	private static final Pattern PARTS = Pattern.compile(
			"(?<label>^[^0-9=-]+)|(?:-(?<tag>[^0-9=-]+))|(?:=(?<parindex>[0-9]+))|(?:-(?<coindex>[0-9]+))");

	private final String label;
	private final List<String> tags;
	private final String coindex;
	private final String parindex;

	// atom this symbol was decoded from, null if built directly
	private final String text;

	public Symbol(String label) {
		this(label, Collections.<String>emptyList(), null, null);
	}

	/**
	 * @param label
	 * @param tags
	 * @param coindex null if absent
	 * @param parindex null if absent
	 */
	public Symbol(String label, List<String> tags, String coindex, String parindex) {
		this(label, tags, coindex, parindex, null);
	}

	private Symbol(String label, List<String> tags, String coindex, String parindex, String text) {
		if(label == null || label.isEmpty())
			throw new IllegalArgumentException("Symbol label must not be empty.");
		this.label = label;
		this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
		this.coindex = coindex;
		this.parindex = parindex;
		this.text = text;
	}

	/**
	 * Decodes an atom into its label, function tags, coindex and gap index.
	 * Characters that fit none of the parts are ignored.
	 * @param atom
	 * @return
	 * @throws MalformedLabelException if the atom does not start with a label, or has two coindices or two gap indices
	 */
	public static Symbol parse(String atom) {
		return decode(atom, false);
	}

	/**
	 * Like {@link #parse(String)}, but every character of atom must belong to the label, a tag or an index.
	 * @throws MalformedLabelException if any character would be dropped
	 */
	public static Symbol parseExact(String atom) {
		return decode(atom, true);
	}

	private static Symbol decode(String atom, boolean exact) {
		String label = null;
		List<String> tags = new ArrayList<>();
		String coindex = null;
		String parindex = null;
		int matched = 0;

		Matcher m = PARTS.matcher(atom);
		while(m.find()) {
			matched += m.end() - m.start();
			if(m.group("label") != null) {
				label = m.group("label");
			}
			else if(m.group("tag") != null) {
				tags.add(m.group("tag"));
			}
			else if(m.group("parindex") != null) {
				if(parindex != null)
					throw new MalformedLabelException(atom, "more than one gap index");
				parindex = m.group("parindex");
			}
			else if(m.group("coindex") != null) {
				if(coindex != null)
					throw new MalformedLabelException(atom, "more than one coindex");
				coindex = m.group("coindex");
			}
		}

		if(label == null)
			throw new MalformedLabelException(atom, "must start with a character other than a digit, - or =");
		if(exact && matched != atom.length())
			throw new MalformedLabelException(atom, "has characters that are not part of a label, tag or index");

		return new Symbol(label, tags, coindex, parindex, atom);
	}

	public String getLabel() {
		return label;
	}

	public List<String> getTags() {
		return tags;
	}

	public String getCoindex() {
		return coindex;
	}

	public String getParindex() {
		return parindex;
	}

	public boolean hasParindex() {
		return parindex != null;
	}

	/**
	 * @return a symbol with only the bare label
	 */
	public Symbol simplify() {
		if(tags.isEmpty() && coindex == null && parindex == null && (text == null || text.equals(label)))
			return this;
		return new Symbol(label);
	}

	public Symbol withoutCoindex() {
		if(coindex == null)
			return this;
		return new Symbol(label, tags, null, parindex);
	}

	public Symbol withLabel(String newLabel) {
		return new Symbol(newLabel, tags, coindex, parindex);
	}

	/**
	 * @return the atom this symbol was decoded from, or the canonical form if it was built directly
	 */
	public String toString() {
		if(text != null)
			return text;
		return toCanonicalString();
	}

	/**
	 * Label, then each tag, then the gap index, then the coindex.
	 */
	public String toCanonicalString() {
		StringBuilder builder = new StringBuilder(label);
		for(String tag : tags) {
			builder.append('-');
			builder.append(tag);
		}
		if(parindex != null) {
			builder.append('=');
			builder.append(parindex);
		}
		if(coindex != null) {
			builder.append('-');
			builder.append(coindex);
		}
		return builder.toString();
	}

	public boolean equals(Object other) {
		if(other instanceof Symbol) {
			Symbol o = (Symbol)other;
			return label.equals(o.label) && tags.equals(o.tags)
					&& (coindex == null ? o.coindex == null : coindex.equals(o.coindex))
					&& (parindex == null ? o.parindex == null : parindex.equals(o.parindex));
		}
		return false;
	}

	public int hashCode() {
		int value = label.hashCode() * 31 + tags.hashCode();
		if(coindex != null)
			value += 17 * coindex.hashCode();
		if(parindex != null)
			value += 29 * parindex.hashCode();
		return value;
	}
}
