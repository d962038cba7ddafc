package edu.uw.easycky.syntax.grammar;

import java.io.Serializable;
import java.util.Collection;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import edu.uw.easycky.syntax.grammar.Production.BinaryProduction;
import edu.uw.easycky.syntax.grammar.Production.LexicalProduction;

/**
 * An immutable grammar in Chomsky Normal Form. Productions keep the order they were added in, which fixes the order
 * parses are returned in.
 *
 * The grammar is assumed to be in CNF already. Nothing here checks that terminals and nonterminals are disjoint.
 */
public class Grammar implements Serializable {
	private static final long serialVersionUID = 1L;

	private final String start;
	private final ImmutableSet<Production> productions;

	public Grammar(final String start, final Collection<? extends Production> productions) {
		this.start = Preconditions.checkNotNull(start, "Grammar needs a start symbol");
		this.productions = ImmutableSet.copyOf(productions);
	}

	public String getStart() {
		return start;
	}

	public ImmutableSet<Production> getProductions() {
		return productions;
	}

	public int size() {
		return productions.size();
	}

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		result.append("%start " + start + "\n");
		for (final Production production : productions) {
			result.append(production);
			result.append("\n");
		}
		return result.toString();
	}

	public static Builder builder(final String start) {
		return new Builder(start);
	}

	public static class Builder {
		private final String start;
		private final ImmutableSet.Builder<Production> productions = ImmutableSet.builder();

		private Builder(final String start) {
			this.start = start;
		}

		/**
		 * Adds A -> B C
		 */
		public Builder binary(final String lhs, final String left, final String right) {
			final BinaryProduction production = Production.binary(lhs, left, right);
			productions.add(production);
			return this;
		}

		/**
		 * Adds A -> w
		 */
		public Builder lexical(final String lhs, final String word) {
			final LexicalProduction production = Production.lexical(lhs, word);
			productions.add(production);
			return this;
		}

		public Builder add(final Production production) {
			productions.add(production);
			return this;
		}

		public Grammar build() {
			return new Grammar(start, productions.build());
		}
	}
}
