package edu.uw.easycky.syntax.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import edu.uw.easycky.syntax.parser.ParseForestNode.BinaryNode;
import edu.uw.easycky.syntax.parser.ParseForestNode.LeafNode;

/**
 * Arena holding every node built for one sentence. Nodes are numbered in the order they were created, and binary
 * nodes point to their children by number.
 *
 * Not thread-safe: a forest belongs to the single parse that fills it.
 */
public class ParseForest {
	private final List<ParseForestNode> nodes = new ArrayList<>();

	LeafNode addLeaf(final String label, final int position, final String word) {
		final LeafNode result = new LeafNode(nodes.size(), label, position, word);
		nodes.add(result);
		return result;
	}

	BinaryNode addBinary(final String label, final ParseForestNode left, final ParseForestNode right) {
		Preconditions.checkArgument(left == get(left.getId()) && right == get(right.getId()),
				"Children must belong to this forest");
		Preconditions.checkArgument(left.getEndOfSpan() == right.getStartOfSpan(),
				"Children spans are not adjacent: %s %s", left, right);
		final BinaryNode result = new BinaryNode(nodes.size(), label, left, right);
		nodes.add(result);
		return result;
	}

	public ParseForestNode get(final int id) {
		Preconditions.checkElementIndex(id, nodes.size(), "node");
		return nodes.get(id);
	}

	public ParseForestNode getLeftChild(final BinaryNode node) {
		return get(node.getLeftChild());
	}

	public ParseForestNode getRightChild(final BinaryNode node) {
		return get(node.getRightChild());
	}

	public List<ParseForestNode> getNodes() {
		return Collections.unmodifiableList(nodes);
	}

	public int size() {
		return nodes.size();
	}
}
