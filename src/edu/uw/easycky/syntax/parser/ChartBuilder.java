package edu.uw.easycky.syntax.parser;

import java.util.List;

import com.google.common.base.Preconditions;

import edu.uw.easycky.syntax.grammar.GrammarIndex;

/**
 * Fills a {@link ChartTable} bottom-up. Every combination of a left and right entry at every split point is kept, so
 * the finished chart packs all derivations of every span.
 *
 * Builders hold no per-sentence state, and may be shared between threads.
 */
public class ChartBuilder {
	private final GrammarIndex index;
	private final int maxChartSize;

	public ChartBuilder(final GrammarIndex index) {
		this(index, Integer.MAX_VALUE);
	}

	public ChartBuilder(final GrammarIndex index, final int maxChartSize) {
		Preconditions.checkArgument(maxChartSize > 0, "maxChartSize must be positive");
		this.index = Preconditions.checkNotNull(index);
		this.maxChartSize = maxChartSize;
	}

	/**
	 * @throws ChartSizeExceededException
	 *             if the chart would hold more than maxChartSize nodes.
	 */
	public ChartTable build(final List<String> words) {
		final ChartTable chart = new ChartTable(words);
		final int numWords = words.size();

		for (int j = 1; j <= numWords; j++) {
			addLexicalEntries(chart, j - 1);

			// (i, k) was filled in an earlier column, (k, j) earlier in this one.
			for (int i = j - 1; i >= 0; i--) {
				final ChartCell cell = chart.getCell(i, j);
				for (int k = i + 1; k < j; k++) {
					combine(chart, chart.getCell(i, k), chart.getCell(k, j), cell);
				}
			}
		}

		return chart;
	}

	private void addLexicalEntries(final ChartTable chart, final int position) {
		final String word = chart.getWords().get(position);
		final ChartCell cell = chart.getCell(position, position + 1);
		for (final String lhs : index.productionsByTerminal(word)) {
			cell.add(chart.getForest().addLeaf(lhs, position, word));
			checkSize(chart);
		}
	}

	private void combine(final ChartTable chart, final ChartCell left, final ChartCell right, final ChartCell result) {
		if (left.isEmpty() || right.isEmpty()) {
			return;
		}

		final ParseForest forest = chart.getForest();
		for (final ParseForestNode l : left.getEntries()) {
			for (final ParseForestNode r : right.getEntries()) {
				for (final String lhs : index.productionsByPair(l.getLabel(), r.getLabel())) {
					result.add(forest.addBinary(lhs, l, r));
					checkSize(chart);
				}
			}
		}
	}

	private void checkSize(final ChartTable chart) {
		if (chart.size() > maxChartSize) {
			throw new ChartSizeExceededException(chart.length(), maxChartSize);
		}
	}

	public GrammarIndex getIndex() {
		return index;
	}
}
