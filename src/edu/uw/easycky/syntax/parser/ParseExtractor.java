package edu.uw.easycky.syntax.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.uw.easycky.syntax.grammar.ParseTree;
import edu.uw.easycky.syntax.parser.ParseForestNode.BinaryNode;
import edu.uw.easycky.syntax.parser.ParseForestNode.LeafNode;

/**
 * Unpacks the trees rooted at the start symbol from a finished chart. Trees come out in the order their roots were
 * added to the top cell. The chart is only read.
 */
public class ParseExtractor {

	private ParseExtractor() {
	}

	public static List<ParseTree> extract(final ChartTable chart, final String startSymbol) {
		if (chart.length() == 0) {
			return Collections.emptyList();
		}

		final List<ParseTree> result = new ArrayList<>();
		for (final ParseForestNode root : chart.getTopCell().getEntries()) {
			if (root.getLabel().equals(startSymbol)) {
				result.add(expand(chart.getForest(), root));
			}
		}
		return result;
	}

	/**
	 * Builds the tree below one node. A node shared by several parents is expanded again for each of them.
	 */
	public static ParseTree expand(final ParseForest forest, final ParseForestNode node) {
		if (node.isLeaf()) {
			final LeafNode leaf = (LeafNode) node;
			return ParseTree.node(leaf.getLabel(), ParseTree.leaf(leaf.getWord()));
		}

		final BinaryNode binary = (BinaryNode) node;
		return ParseTree.node(binary.getLabel(), expand(forest, forest.getLeftChild(binary)),
				expand(forest, forest.getRightChild(binary)));
	}
}
