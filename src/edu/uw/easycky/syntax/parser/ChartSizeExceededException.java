package edu.uw.easycky.syntax.parser;

/**
 * Thrown when a chart grows past the size the parser was configured with. The parse is abandoned, rather than
 * returning an incomplete set of trees.
 */
public class ChartSizeExceededException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final int maxChartSize;

	public ChartSizeExceededException(final int sentenceLength, final int maxChartSize) {
		super("Chart for sentence of length " + sentenceLength + " exceeded " + maxChartSize + " entries");
		this.maxChartSize = maxChartSize;
	}

	public int getMaxChartSize() {
		return maxChartSize;
	}
}
