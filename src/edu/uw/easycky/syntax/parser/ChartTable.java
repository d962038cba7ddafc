package edu.uw.easycky.syntax.parser;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Triangular CKY chart. Cell (i, j) holds the nodes spanning words i to j-1, for 0 <= i < j <= n.
 */
public class ChartTable {
	private final ImmutableList<String> words;
	private final ChartCell[][] chart;
	private final ParseForest forest;

	ChartTable(final List<String> words) {
		this.words = ImmutableList.copyOf(words);
		final int size = words.size() + 1;
		this.chart = new ChartCell[size][size];
		for (int j = 1; j < size; j++) {
			for (int i = 0; i < j; i++) {
				chart[i][j] = new ChartCell(i, j);
			}
		}
		this.forest = new ParseForest();
	}

	public ChartCell getCell(final int start, final int end) {
		Preconditions.checkPositionIndex(end, words.size(), "end of span");
		Preconditions.checkElementIndex(start, end, "start of span");
		return chart[start][end];
	}

	/**
	 * The cell covering the whole sentence. Only valid for non-empty sentences.
	 */
	public ChartCell getTopCell() {
		Preconditions.checkState(!words.isEmpty(), "An empty sentence has no chart cells");
		return getCell(0, words.size());
	}

	public ParseForest getForest() {
		return forest;
	}

	public List<String> getWords() {
		return words;
	}

	public int length() {
		return words.size();
	}

	/**
	 * Total number of nodes in the chart.
	 */
	public int size() {
		return forest.size();
	}
}
