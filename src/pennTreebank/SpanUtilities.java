package pennTreebank;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

public class SpanUtilities {
	private SpanUtilities() {
	}

	/**
	 * Orders spans by start, then empty spans before non-empty ones, then by end descending.
	 * Sorting is stable, so identical spans keep the order they were added in.
	 */
	public static final Comparator<Span> SPAN_ORDER = new Comparator<Span>() {
		@Override
		public int compare(Span s0, Span s1) {
			if(s0.getStart() != s1.getStart())
				return Integer.compare(s0.getStart(), s1.getStart());
			if(s0.isEmpty() != s1.isEmpty())
				return s0.isEmpty() ? -1 : 1;
			return Integer.compare(s1.getEnd(), s0.getEnd());
		}
	};

	private static class SpanState {
		int position = 0;
		List<Span> spans = new ArrayList<>();
		// slot in spans reserved by each open node, and where the node began
		Deque<Integer> slots = new ArrayDeque<>();
		Deque<Integer> starts = new ArrayDeque<>();
	}

	private static final TreeVisitor<SpanState> spanVisitor = new TreeVisitor<SpanState>() {
		@Override
		public SpanState pre(TreeNode node, SpanState state) {
			state.slots.push(state.spans.size());
			state.starts.push(state.position);
			state.spans.add(null);
			return state;
		}

		@Override
		public SpanState post(TreeNode node, SpanState state) {
			if(node.isTerminal() && !((Terminal)node).isNone())
				state.position++;
			int slot = state.slots.pop();
			int start = state.starts.pop();
			state.spans.set(slot, new Span(node.getLabel(), start, state.position));
			return state;
		}
	};

	/**
	 * Gets the span of every terminal and non-terminal in the tree, sorted by {@link #SPAN_ORDER}.
	 * Each non -NONE- terminal covers one position; -NONE- terminals get a zero width span.
	 * Spans that are identical keep pre-order, so a parent comes before a child with the same range.
	 * @param tree
	 * @return
	 */
	public static List<Span> allSpans(TreeNode tree) {
		SpanState state = TreeTraversal.traverse(tree, spanVisitor, new SpanState());
		List<Span> result = state.spans;
		Collections.sort(result, SPAN_ORDER);
		return result;
	}

	/**
	 * Returns an int[] where each element is the index of the parent span in spans or -1 if no parent.
	 * The parent is the narrowest other span containing the span; among identical spans the one listed
	 * earlier is the parent.
	 * @param spans ordered as by {@link #allSpans(TreeNode)}, from a tree without empty elements
	 * @return
	 */
	public static int[] getParents(List<Span> spans) {
		int[] result = new int[spans.size()];
		for(int i = 0; i < result.length; i++) {
			Span s = spans.get(i);
			if(s.isEmpty())
				throw new IllegalArgumentException("Cannot find the parent of an empty span, remove empty elements first: " + s);
			result[i] = -1;
			for(int j = 0; j < result.length; j++) {
				if(i == j)
					continue;

				Span p = spans.get(j);
				if(!p.contains(s))
					continue;
				if(p.getLength() == s.getLength() && j > i)
					continue;
				if(result[i] == -1 || p.getLength() < spans.get(result[i]).getLength()
						|| (p.getLength() == spans.get(result[i]).getLength() && j > result[i]))
					result[i] = j;
			}
		}
		return result;
	}

	/**
	 * Throws exception if spans are not well formed: exactly one top level span, and no two spans crossing.
	 */
	public static void checkCorrectness(List<Span> spans) {
		int[] parents = getParents(spans);
		int topLevelCount = 0;
		for(int i = 0; i < spans.size(); i++) {
			if(parents[i] == -1)
				topLevelCount++;
			for(int j = i + 1; j < spans.size(); j++) {
				Span a = spans.get(i);
				Span b = spans.get(j);
				if(a.getStart() < b.getStart() && b.getStart() < a.getEnd() && a.getEnd() < b.getEnd())
					throw new IllegalStateException("Spans cross: " + a + ", " + b);
			}
		}
		if(topLevelCount != 1)
			throw new IllegalStateException("Top level count is not 1, it is " + topLevelCount);
	}

	/**
	 * Prints spans for a sentence in a way that is relatively easier to read: one column per word,
	 * widest spans on top.  Empty spans cover no word and are not shown.
	 * @param spans
	 * @param numberOfWords
	 * @param out
	 */
	public static void printSpans(final List<Span> spans, int numberOfWords, PrintStream out) {
		List<List<Integer>> list = new ArrayList<>();
		for(int i = 0; i < numberOfWords; i++) {
			list.add(new ArrayList<Integer>());
		}
		for(int s = 0; s < spans.size(); s++) {
			Span span = spans.get(s);
			for(int i = span.getStart(); i < span.getEnd(); i++) {
				list.get(i).add(s);
			}
		}
		for(List<Integer> inner : list) {
			Collections.sort(inner, new Comparator<Integer>() {
				@Override
				public int compare(Integer arg0, Integer arg1) {
					return spans.get(arg1).getLength() - spans.get(arg0).getLength();
				}
			});
		}

		boolean finished = false;
		int index = 0;
		while(!finished) {
			finished = true;
			int last = -1;
			StringBuilder line = new StringBuilder();
			for(List<Integer> inner : list) {
				if(index < inner.size()) {
					int spanIndex = inner.get(index);
					if(spanIndex == last)
						line.append("-------->");
					else {
						last = spanIndex;
						line.append(String.format("<%-7s>", spans.get(spanIndex).getLabel()));
					}
					finished = false;
				}
				else {
					last = -1;
					line.append("         ");
				}
			}
			if(!finished)
				out.println(line.toString().replaceAll("\\s+$", ""));
			index++;
		}
	}
}
