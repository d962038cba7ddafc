package edu.uw.easycky.syntax.grammar;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A rule of a grammar in Chomsky Normal Form: either A -> w or A -> B C.
 */
public abstract class Production implements Serializable {
	private static final long serialVersionUID = 1L;
	private final String lhs;

	private Production(final String lhs) {
		this.lhs = Preconditions.checkNotNull(lhs);
	}

	public String getLhs() {
		return lhs;
	}

	public abstract List<String> getRhs();

	public abstract boolean isLexical();

	public static LexicalProduction lexical(final String lhs, final String word) {
		return new LexicalProduction(lhs, word);
	}

	public static BinaryProduction binary(final String lhs, final String left, final String right) {
		return new BinaryProduction(lhs, left, right);
	}

	public static class LexicalProduction extends Production {
		private static final long serialVersionUID = 1L;
		private final String word;

		private LexicalProduction(final String lhs, final String word) {
			super(lhs);
			this.word = Preconditions.checkNotNull(word);
		}

		public String getWord() {
			return word;
		}

		@Override
		public List<String> getRhs() {
			return ImmutableList.of(word);
		}

		@Override
		public boolean isLexical() {
			return true;
		}

		@Override
		public int hashCode() {
			return Objects.hash(getLhs(), word);
		}

		@Override
		public boolean equals(final Object obj) {
			if (!(obj instanceof LexicalProduction)) {
				return false;
			}
			final LexicalProduction other = (LexicalProduction) obj;
			return getLhs().equals(other.getLhs()) && word.equals(other.word);
		}

		@Override
		public String toString() {
			return getLhs() + " -> '" + word + "'";
		}
	}

	public static class BinaryProduction extends Production {
		private static final long serialVersionUID = 1L;
		private final String left;
		private final String right;

		private BinaryProduction(final String lhs, final String left, final String right) {
			super(lhs);
			this.left = Preconditions.checkNotNull(left);
			this.right = Preconditions.checkNotNull(right);
		}

		public String getLeft() {
			return left;
		}

		public String getRight() {
			return right;
		}

		@Override
		public List<String> getRhs() {
			return ImmutableList.of(left, right);
		}

		@Override
		public boolean isLexical() {
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(getLhs(), left, right);
		}

		@Override
		public boolean equals(final Object obj) {
			if (!(obj instanceof BinaryProduction)) {
				return false;
			}
			final BinaryProduction other = (BinaryProduction) obj;
			return getLhs().equals(other.getLhs()) && left.equals(other.left) && right.equals(other.right);
		}

		@Override
		public String toString() {
			return getLhs() + " -> " + left + " " + right;
		}
	}
}
