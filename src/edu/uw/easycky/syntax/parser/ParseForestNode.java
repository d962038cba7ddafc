package edu.uw.easycky.syntax.parser;

/**
 * One derivation step: a labelled span with either a word or two child nodes beneath it. Nodes are created by a
 * {@link ParseForest}, and children are referred to by their index in that forest.
 *
 * Two nodes with the same label and span are different derivations unless they are the same node, so equality is
 * left as object identity.
 */
public abstract class ParseForestNode {
	private final int id;
	private final String label;
	private final int start;
	private final int end;

	private ParseForestNode(final int id, final String label, final int start, final int end) {
		this.id = id;
		this.label = label;
		this.start = start;
		this.end = end;
	}

	/**
	 * Index of this node in its forest.
	 */
	public int getId() {
		return id;
	}

	public String getLabel() {
		return label;
	}

	public int getStartOfSpan() {
		return start;
	}

	public int getEndOfSpan() {
		return end;
	}

	public int getSpanLength() {
		return end - start;
	}

	public abstract boolean isLeaf();

	@Override
	public String toString() {
		return label + "[" + start + "," + end + "]#" + id;
	}

	/**
	 * A -> w over span (i, i+1).
	 */
	public static class LeafNode extends ParseForestNode {
		private final String word;

		LeafNode(final int id, final String label, final int position, final String word) {
			super(id, label, position, position + 1);
			this.word = word;
		}

		public String getWord() {
			return word;
		}

		@Override
		public boolean isLeaf() {
			return true;
		}
	}

	/**
	 * A -> B C over span (i, j), with B over (i, k) and C over (k, j).
	 */
	public static class BinaryNode extends ParseForestNode {
		private final int leftChild;
		private final int rightChild;
		private final int split;

		BinaryNode(final int id, final String label, final ParseForestNode left, final ParseForestNode right) {
			super(id, label, left.getStartOfSpan(), right.getEndOfSpan());
			this.leftChild = left.getId();
			this.rightChild = right.getId();
			this.split = left.getEndOfSpan();
		}

		public int getLeftChild() {
			return leftChild;
		}

		public int getRightChild() {
			return rightChild;
		}

		public int getSplit() {
			return split;
		}

		@Override
		public boolean isLeaf() {
			return false;
		}
	}
}
