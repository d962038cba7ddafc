package edu.uw.easycky.syntax.grammar;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import com.google.common.collect.Table.Cell;

import edu.uw.easycky.syntax.grammar.Production.BinaryProduction;
import edu.uw.easycky.syntax.grammar.Production.LexicalProduction;

/**
 * Lookup tables from right-hand sides to left-hand sides. Immutable once built, so one index can be shared by any
 * number of parser threads.
 */
public class GrammarIndex {
	private final String start;
	private final ImmutableSetMultimap<String, String> wordToLhs;
	private final ImmutableTable<String, String, ImmutableSet<String>> pairToLhs;

	private GrammarIndex(final String start, final ImmutableSetMultimap<String, String> wordToLhs,
			final ImmutableTable<String, String, ImmutableSet<String>> pairToLhs) {
		this.start = start;
		this.wordToLhs = wordToLhs;
		this.pairToLhs = pairToLhs;
	}

	public static GrammarIndex build(final Grammar grammar) {
		final ImmutableSetMultimap.Builder<String, String> wordToLhs = ImmutableSetMultimap.builder();
		// Set builders keep insertion order, so lookups come back in grammar order.
		final Table<String, String, ImmutableSet.Builder<String>> pairToLhs = HashBasedTable.create();
		for (final Production production : grammar.getProductions()) {
			if (production.isLexical()) {
				wordToLhs.put(((LexicalProduction) production).getWord(), production.getLhs());
			} else {
				final BinaryProduction binary = (BinaryProduction) production;
				ImmutableSet.Builder<String> lhs = pairToLhs.get(binary.getLeft(), binary.getRight());
				if (lhs == null) {
					lhs = ImmutableSet.builder();
					pairToLhs.put(binary.getLeft(), binary.getRight(), lhs);
				}
				lhs.add(binary.getLhs());
			}
		}

		final ImmutableTable.Builder<String, String, ImmutableSet<String>> table = ImmutableTable.builder();
		for (final Cell<String, String, ImmutableSet.Builder<String>> cell : pairToLhs.cellSet()) {
			table.put(cell.getRowKey(), cell.getColumnKey(), cell.getValue().build());
		}

		return new GrammarIndex(grammar.getStart(), wordToLhs.build(), table.build());
	}

	public String getStart() {
		return start;
	}

	/**
	 * All A such that A -> word is a production.
	 */
	public ImmutableSet<String> productionsByTerminal(final String word) {
		return wordToLhs.get(word);
	}

	/**
	 * All A such that A -> left right is a production.
	 */
	public ImmutableSet<String> productionsByPair(final String left, final String right) {
		final ImmutableSet<String> result = pairToLhs.get(left, right);
		return result == null ? ImmutableSet.of() : result;
	}
}
