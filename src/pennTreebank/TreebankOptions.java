package pennTreebank;

import java.util.Arrays;
import java.util.List;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TreebankOptions {
	private static final Logger logger = LoggerFactory.getLogger(TreebankOptions.class);

	public static final List<String> COMMANDS = Arrays.asList("transform", "spans", "index", "structure", "terminals");

	public String command = "transform";
	public String inputFile = null; // null reads standard input
	public boolean removeEmpty = false;
	public boolean simplify = false;
	public String rootLabel = null; // null leaves the root alone
	public boolean includeNulls = false;
	public boolean diagram = false;

	public TreebankOptions(String[] args) {
		OptionParser parser = new OptionParser("c:f:esr:and");
		OptionSet options = parser.parse(args);

		if(options.has("c")) {
			command = (String)options.valueOf("c");
			if(!COMMANDS.contains(command))
				throw new IllegalArgumentException("Unknown command " + command + ", expected one of " + COMMANDS);
		}
		if(options.has("f")) {
			inputFile = (String)options.valueOf("f");
		}
		else if(!options.nonOptionArguments().isEmpty()) {
			inputFile = options.nonOptionArguments().get(0).toString();
		}
		if(options.has("e")) {
			removeEmpty = true;
		}
		if(options.has("s")) {
			simplify = true;
		}
		if(options.has("a")) {
			rootLabel = TreeTransforms.DEFAULT_ROOT_LABEL;
		}
		if(options.has("r")) {
			rootLabel = (String)options.valueOf("r");
			Symbol.parseExact(rootLabel); // fail before reading any input
		}
		if(options.has("n")) {
			includeNulls = true;
		}
		if(options.has("d")) {
			diagram = true;
		}

		logger.debug("command: {}", command);
		logger.debug("input: {}", inputFile == null ? "standard input" : inputFile);
		logger.debug("removeEmpty: {}, simplify: {}, root label: {}", removeEmpty, simplify, rootLabel);
		logger.debug("includeNulls: {}, diagram: {}", includeNulls, diagram);
	}

	public static String usage() {
		return "Usage: [-c transform|spans|index|structure|terminals] [-e] [-s] [-a | -r LABEL] [-n] [-d] [-f FILE | FILE]\n"
				+ "  -c  command to run, default transform\n"
				+ "  -e  remove empty elements\n"
				+ "  -s  strip function tags and indices from labels\n"
				+ "  -a  add a ROOT node, -r to choose its label\n"
				+ "  -n  include -NONE- terminals when listing terminals\n"
				+ "  -d  print spans as a diagram\n"
				+ "  FILE treebank file, standard input if missing";
	}
}
