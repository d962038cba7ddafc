package edu.uw.easycky.syntax.parser;

import static edu.uw.easycky.syntax.grammar.GrammarFixtures.words;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import org.junit.Test;

import edu.uw.easycky.syntax.grammar.Grammar;
import edu.uw.easycky.syntax.grammar.GrammarFixtures;
import edu.uw.easycky.syntax.grammar.GrammarIndex;
import edu.uw.easycky.syntax.grammar.ParseTree;

public class ParserCKYTest {

	private final Grammar toy = GrammarFixtures.toy();
	private final Parser toyParser = new ParserCKY.Builder(toy).build();

	@Test
	public void testSingleParse() {
		final List<ParseTree> parses = toyParser.parseTokens(words("the dog chased the cat"));

		assertThat(parses.size(), is(1));
		final ParseTree expected = ParseTree.node("S",
				ParseTree.node("NP", ParseTree.node("Det", ParseTree.leaf("the")), ParseTree.node("N", ParseTree.leaf("dog"))),
				ParseTree.node("VP", ParseTree.node("V", ParseTree.leaf("chased")),
						ParseTree.node("NP", ParseTree.node("Det", ParseTree.leaf("the")),
								ParseTree.node("N", ParseTree.leaf("cat")))));
		assertThat(parses.get(0), is(expected));
	}

	@Test
	public void testUngrammaticalSentence() {
		assertTrue(toyParser.parseTokens(words("the dog dog")).isEmpty());
	}

	@Test
	public void testUnknownWord() {
		assertTrue(toyParser.parseTokens(words("the dog chased the giraffe")).isEmpty());
	}

	@Test
	public void testEmptySentence() {
		assertTrue(toyParser.parseTokens(Collections.<String> emptyList()).isEmpty());
	}

	@Test
	public void testLexicalAmbiguity() {
		final Grammar grammar = Grammar.builder("S").binary("S", "NP", "V").binary("S", "Noun", "V").lexical("NP", "dog")
				.lexical("Noun", "dog").lexical("V", "barks").build();
		final List<ParseTree> parses = ParserCKY.parse(words("dog barks"), grammar, GrammarIndex.build(grammar));

		assertThat(parses.size(), is(2));
		assertThat(parses.get(0).toString(), is("(S (NP dog) (V barks))"));
		assertThat(parses.get(1).toString(), is("(S (Noun dog) (V barks))"));
		assertThat(parses.get(0).getYield(), is(parses.get(1).getYield()));
	}

	@Test
	public void testSingleWordFromStartSymbol() {
		final Grammar grammar = Grammar.builder("S").lexical("S", "hello").build();
		final List<ParseTree> parses = ParserCKY.parse(words("hello"), grammar, GrammarIndex.build(grammar));

		assertThat(parses, is(Collections.singletonList((ParseTree) ParseTree.node("S", ParseTree.leaf("hello")))));
		assertThat(parses.get(0).getHeight(), is(1));
	}

	@Test
	public void testSingleWordNotFromStartSymbol() {
		assertTrue(toyParser.parseTokens(words("dog")).isEmpty());
	}

	@Test
	public void testDeterministic() {
		final Parser parser = new ParserCKY.Builder(GrammarFixtures.ppAttachment()).build();
		final List<String> sentence = words("I saw the man with the telescope with the telescope");
		final List<ParseTree> first = parser.parseTokens(sentence);
		assertThat(parser.parseTokens(sentence), is(first));
		assertThat(new ParserCKY.Builder(GrammarFixtures.ppAttachment()).build().parseTokens(sentence), is(first));
	}

	@Test
	public void testCoverageAndSoundness() {
		final Grammar grammar = GrammarFixtures.ppAttachment();
		final Parser parser = new ParserCKY.Builder(grammar).build();
		final List<String> sentence = words("I saw a man with the telescope with a telescope");
		final List<ParseTree> parses = parser.parseTokens(sentence);

		assertTrue(parses.size() > 1);
		for (final ParseTree parse : parses) {
			assertThat(parse.getLabel(), is("S"));
			assertThat(parse.getYield(), is(sentence));
			assertTrue(parse.toString(), GrammarFixtures.isSound(grammar, parse));
		}
	}

	@Test
	public void testCompleteness() {
		checkAgainstBruteForce(GrammarFixtures.toy(), "the dog chased the cat");
		checkAgainstBruteForce(GrammarFixtures.ppAttachment(), "I saw the man with the telescope");
		checkAgainstBruteForce(GrammarFixtures.ppAttachment(), "I saw the man with a telescope with the man");
		checkAgainstBruteForce(GrammarFixtures.catalan(), "a a a a a a");
	}

	@Test
	public void testCatalanNumberOfParses() {
		final Grammar grammar = GrammarFixtures.catalan();
		final GrammarIndex index = GrammarIndex.build(grammar);
		final int[] catalan = { 1, 1, 2, 5, 14, 42, 132, 429 };
		for (int n = 1; n <= catalan.length; n++) {
			final List<ParseTree> parses = ParserCKY.parse(Collections.nCopies(n, "a"), grammar, index);
			assertThat(parses.size(), is(catalan[n - 1]));
			assertThat(new HashSet<>(parses).size(), is(parses.size()));
		}
	}

	@Test
	public void testSentenceTooLong() {
		final Parser parser = new ParserCKY.Builder(toy).maximumSentenceLength(3).build();
		assertThat(parser.getMaxSentenceLength(), is(3));
		assertTrue(parser.parseTokens(words("the dog chased the cat")).isEmpty());
		assertTrue(parser.parseTokens(words("the dog")).isEmpty());
	}

	@Test(expected = ChartSizeExceededException.class)
	public void testChartSizeLimit() {
		new ParserCKY.Builder(GrammarFixtures.catalan()).maxChartSize(50).build()
				.parseTokens(Collections.nCopies(10, "a"));
	}

	@Test
	public void testSharedIndex() {
		final GrammarIndex index = GrammarIndex.build(toy);
		final AbstractParser parser = new ParserCKY.Builder(toy).index(index).build();
		assertTrue(parser.getIndex() == index);
		assertThat(parser.parseTokens(words("the cat chased the dog")).size(), is(1));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testIndexForOtherGrammar() {
		new ParserCKY.Builder(toy).index(GrammarIndex.build(GrammarFixtures.catalan())).build();
	}

	@Test
	public void testConcurrentParsesShareParser() throws InterruptedException {
		final Parser parser = new ParserCKY.Builder(GrammarFixtures.ppAttachment()).build();
		final List<String> sentence = words("I saw the man with the telescope with the man");
		final List<ParseTree> expected = parser.parseTokens(sentence);
		final boolean[] agree = new boolean[8];

		final Thread[] threads = new Thread[agree.length];
		for (int i = 0; i < threads.length; i++) {
			final int id = i;
			threads[i] = new Thread(() -> agree[id] = parser.parseTokens(sentence).equals(expected));
			threads[i].start();
		}
		for (final Thread thread : threads) {
			thread.join();
		}

		for (final boolean result : agree) {
			assertTrue(result);
		}
	}

	private static void checkAgainstBruteForce(final Grammar grammar, final String sentence) {
		final List<String> words = words(sentence);
		final List<ParseTree> parses = ParserCKY.parse(words, grammar, GrammarIndex.build(grammar));

		assertThat(new HashSet<>(parses).size(), is(parses.size()));
		assertThat(new HashSet<>(parses),
				is(GrammarFixtures.enumerate(grammar, words, grammar.getStart(), 0, words.size())));
	}
}
