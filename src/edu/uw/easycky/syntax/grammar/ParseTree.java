package edu.uw.easycky.syntax.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A fully materialized derivation, ready to be printed. Equality is structural.
 */
public abstract class ParseTree implements Serializable {
	private static final long serialVersionUID = 1L;

	private ParseTree() {
	}

	public abstract void accept(ParseTreeVisitor v);

	public abstract List<ParseTree> getChildren();

	public abstract boolean isLeaf();

	/**
	 * The nonterminal for internal nodes, or the word for leaves.
	 */
	public abstract String getLabel();

	public ParseTree getChild(final int index) {
		return getChildren().get(index);
	}

	/**
	 * The words covered by this tree, left to right.
	 */
	public List<String> getYield() {
		final List<String> result = new ArrayList<>();
		getYield(result);
		return result;
	}

	abstract void getYield(List<String> result);

	public int getHeight() {
		int result = 0;
		for (final ParseTree child : getChildren()) {
			result = Math.max(result, child.getHeight());
		}
		return isLeaf() ? 0 : result + 1;
	}

	public interface ParseTreeVisitor {
		void visit(ParseTreeNode node);

		void visit(ParseTreeLeaf node);
	}

	public static ParseTreeLeaf leaf(final String word) {
		return new ParseTreeLeaf(word);
	}

	public static ParseTreeNode node(final String symbol, final ParseTree... children) {
		return new ParseTreeNode(symbol, ImmutableList.copyOf(children));
	}

	public static class ParseTreeLeaf extends ParseTree {
		private static final long serialVersionUID = 1L;
		private final String word;

		private ParseTreeLeaf(final String word) {
			this.word = Preconditions.checkNotNull(word);
		}

		public String getWord() {
			return word;
		}

		@Override
		public String getLabel() {
			return word;
		}

		@Override
		public void accept(final ParseTreeVisitor v) {
			v.visit(this);
		}

		@Override
		public List<ParseTree> getChildren() {
			return Collections.emptyList();
		}

		@Override
		public boolean isLeaf() {
			return true;
		}

		@Override
		void getYield(final List<String> result) {
			result.add(word);
		}

		@Override
		public int hashCode() {
			return word.hashCode();
		}

		@Override
		public boolean equals(final Object obj) {
			return obj instanceof ParseTreeLeaf && word.equals(((ParseTreeLeaf) obj).word);
		}

		@Override
		public String toString() {
			return word;
		}
	}

	public static class ParseTreeNode extends ParseTree {
		private static final long serialVersionUID = 1L;
		private final String symbol;
		private final ImmutableList<ParseTree> children;

		private ParseTreeNode(final String symbol, final ImmutableList<ParseTree> children) {
			Preconditions.checkArgument(children.size() == 1 || children.size() == 2,
					"Expected 1 or 2 children for " + symbol + " but got " + children.size());
			Preconditions.checkArgument(children.size() == 2 || children.get(0).isLeaf(),
					"A unary node must dominate a word: " + symbol);
			this.symbol = Preconditions.checkNotNull(symbol);
			this.children = children;
		}

		public String getSymbol() {
			return symbol;
		}

		@Override
		public String getLabel() {
			return symbol;
		}

		@Override
		public void accept(final ParseTreeVisitor v) {
			v.visit(this);
		}

		@Override
		public List<ParseTree> getChildren() {
			return children;
		}

		@Override
		public boolean isLeaf() {
			return false;
		}

		/**
		 * True for nodes directly over a word, i.e. A -> w.
		 */
		public boolean isPreterminal() {
			return children.size() == 1;
		}

		@Override
		void getYield(final List<String> result) {
			for (final ParseTree child : children) {
				child.getYield(result);
			}
		}

		@Override
		public int hashCode() {
			return Objects.hash(symbol, children);
		}

		@Override
		public boolean equals(final Object obj) {
			if (!(obj instanceof ParseTreeNode)) {
				return false;
			}
			final ParseTreeNode other = (ParseTreeNode) obj;
			return symbol.equals(other.symbol) && children.equals(other.children);
		}

		@Override
		public String toString() {
			final StringBuilder result = new StringBuilder();
			result.append("(");
			result.append(symbol);
			for (final ParseTree child : children) {
				result.append(" ");
				result.append(child);
			}
			result.append(")");
			return result.toString();
		}
	}
}
