package pennTreebank;
import java.util.ArrayList;
import java.util.List;

/**
 * An internal node: a decoded symbol over an ordered list of children.
 */
public class NonTerminal extends TreeNode {
	private Symbol symbol;
	private List<TreeNode> children = new ArrayList<>();

	public NonTerminal(Symbol symbol, TreeNode... children) {
		this.symbol = symbol;
		for(TreeNode child : children) {
			this.children.add(child);
		}
	}

	public NonTerminal(Symbol symbol, List<TreeNode> children) {
		this.symbol = symbol;
		this.children.addAll(children);
	}

	/**
	 * Decodes label with {@link Symbol#parse(String)}
	 */
	public NonTerminal(String label, TreeNode... children) {
		this(Symbol.parse(label), children);
	}

	@Override
	public boolean isNonTerminal() {
		return true;
	}

	public Symbol getSymbol() {
		return symbol;
	}

	public void setSymbol(Symbol symbol) {
		this.symbol = symbol;
	}

	@Override
	public List<TreeNode> getChildren() {
		return children;
	}

	@Override
	public String getLabel() {
		return symbol.toString();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append('(');
		builder.append(symbol);
		for(TreeNode child : children) {
			builder.append(' ');
			builder.append(child.toString());
		}
		builder.append(')');
		return builder.toString();
	}

	public int hashCode() {
		return 53 + symbol.hashCode() + children.hashCode();
	}

	public boolean equals(Object other) {
		if(!(other instanceof NonTerminal))
			return false;
		NonTerminal o = (NonTerminal)other;
		return symbol.equals(o.symbol) && children.equals(o.children);
	}
}
