package edu.uw.easycky.syntax.parser;

import com.google.common.base.Preconditions;

import edu.uw.easycky.syntax.grammar.Grammar;
import edu.uw.easycky.syntax.grammar.GrammarIndex;

public abstract class ParserBuilder<T extends ParserBuilder<T>> {

	ParserBuilder(final Grammar grammar) {
		this.grammar = Preconditions.checkNotNull(grammar);
	}

	private final Grammar grammar;
	private GrammarIndex index;
	private int maxSentenceLength = 70;
	private int maxChartSize = 1000000;

	public Grammar getGrammar() {
		return grammar;
	}

	public GrammarIndex getIndex() {
		return index;
	}

	public int getMaxSentenceLength() {
		return maxSentenceLength;
	}

	public int getMaxChartSize() {
		return maxChartSize;
	}

	/**
	 * Reuse an index that was already built for this grammar.
	 */
	public T index(final GrammarIndex index) {
		this.index = index;
		return getThis();
	}

	public T maximumSentenceLength(final int maxSentenceLength) {
		Preconditions.checkArgument(maxSentenceLength >= 0, "maximumSentenceLength must not be negative");
		this.maxSentenceLength = maxSentenceLength;
		return getThis();
	}

	public T maxChartSize(final int maxChartSize) {
		Preconditions.checkArgument(maxChartSize > 0, "maxChartSize must be positive");
		this.maxChartSize = maxChartSize;
		return getThis();
	}

	@SuppressWarnings("unchecked")
	T getThis() {
		return (T) this;
	}

	public AbstractParser build() {
		if (index != null) {
			Preconditions.checkArgument(index.getStart().equals(grammar.getStart()),
					"Index was built for a grammar with a different start symbol");
		}
		return build2();
	}

	protected abstract AbstractParser build2();
}
