package edu.uw.easycky.syntax.parser;

import java.util.List;

import edu.uw.easycky.syntax.grammar.Grammar;
import edu.uw.easycky.syntax.grammar.GrammarIndex;
import edu.uw.easycky.syntax.grammar.ParseTree;

/**
 * Exhaustive CKY parser for grammars in Chomsky Normal Form. Returns all parses, unranked.
 */
public class ParserCKY extends AbstractParser {

	private final ChartBuilder chartBuilder;

	protected ParserCKY(final Builder builder) {
		super(builder);
		this.chartBuilder = new ChartBuilder(index, builder.getMaxChartSize());
	}

	@Override
	protected List<ParseTree> parse(final List<String> words) {
		final ChartTable chart = chartBuilder.build(words);
		return ParseExtractor.extract(chart, grammar.getStart());
	}

	/**
	 * Parses without any limits on sentence length or chart size.
	 */
	public static List<ParseTree> parse(final List<String> words, final Grammar grammar, final GrammarIndex index) {
		final ChartTable chart = new ChartBuilder(index).build(words);
		return ParseExtractor.extract(chart, grammar.getStart());
	}

	public static class Builder extends ParserBuilder<Builder> {

		public Builder(final Grammar grammar) {
			super(grammar);
		}

		@Override
		protected ParserCKY build2() {
			return new ParserCKY(this);
		}
	}
}
