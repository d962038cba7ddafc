package edu.uw.easycky.syntax.parser;

import static edu.uw.easycky.syntax.grammar.GrammarFixtures.words;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

import edu.uw.easycky.syntax.grammar.GrammarFixtures;
import edu.uw.easycky.syntax.grammar.GrammarIndex;
import edu.uw.easycky.syntax.grammar.ParseTree;

public class ParseExtractorTest {

	private final ChartTable chart = new ChartBuilder(GrammarIndex.build(GrammarFixtures.ppAttachment()))
			.build(words("I saw the man with the telescope"));

	@Test
	public void testTreesInDiscoveryOrder() {
		final List<ParseTree> parses = ParseExtractor.extract(chart, "S");
		assertThat(parses.size(), is(2));

		// "the man with the telescope" is found before "saw the man" + "with the telescope".
		assertThat(parses.get(0).toString(),
				is("(S (NP I) (VP (V saw) (NP (NP (Det the) (N man)) (PP (P with) (NP (Det the) (N telescope))))))"));
		assertThat(parses.get(1).toString(),
				is("(S (NP I) (VP (VP (V saw) (NP (Det the) (N man))) (PP (P with) (NP (Det the) (N telescope)))))"));
	}

	@Test
	public void testSharedNodesExpandedPerParent() {
		final List<ParseTree> parses = ParseExtractor.extract(chart, "S");

		// Both parses share the chart node for "I".
		final ParseTree first = parses.get(0).getChild(0);
		final ParseTree second = parses.get(1).getChild(0);
		assertThat(first, is(second));
		assertNotSame(first, second);
		assertThat(parses.get(0), not(parses.get(1)));
	}

	@Test
	public void testOnlyStartSymbolRoots() {
		assertTrue(ParseExtractor.extract(chart, "VP").isEmpty());
		assertTrue(ParseExtractor.extract(chart, "NP").isEmpty());
	}

	@Test
	public void testExtractionLeavesChartUnchanged() {
		final int size = chart.size();
		ParseExtractor.extract(chart, "S");
		ParseExtractor.extract(chart, "S");
		assertThat(chart.size(), is(size));
		assertThat(chart.getTopCell().size(), is(2));
	}

	@Test
	public void testExpandSubtree() {
		final ParseForestNode vp = chart.getCell(1, 4).getEntries().get(0);
		assertThat(ParseExtractor.expand(chart.getForest(), vp).toString(), is("(VP (V saw) (NP (Det the) (N man)))"));
	}

	@Test
	public void testEmptyChart() {
		final ChartTable empty = new ChartBuilder(GrammarIndex.build(GrammarFixtures.toy())).build(Collections
				.<String> emptyList());
		assertTrue(ParseExtractor.extract(empty, "S").isEmpty());
	}
}
