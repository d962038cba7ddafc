package edu.uw.easycky.syntax.parser;

import java.util.Collections;
import java.util.List;

import edu.uw.easycky.syntax.grammar.Grammar;
import edu.uw.easycky.syntax.grammar.GrammarIndex;
import edu.uw.easycky.syntax.grammar.ParseTree;

public abstract class AbstractParser implements Parser {

	protected final Grammar grammar;
	protected final GrammarIndex index;
	protected final int maxLength;

	public AbstractParser(final ParserBuilder<?> builder) {
		this.grammar = builder.getGrammar();
		this.index = builder.getIndex() == null ? GrammarIndex.build(grammar) : builder.getIndex();
		this.maxLength = builder.getMaxSentenceLength();
	}

	@Override
	public List<ParseTree> parseTokens(final List<String> words) {
		if (words.size() > maxLength) {
			System.err.println("Skipping sentence of length " + words.size());
			return Collections.emptyList();
		}

		return parse(words);
	}

	/**
	 * Parses a sentence that is known to be short enough.
	 */
	protected abstract List<ParseTree> parse(List<String> words);

	@Override
	public int getMaxSentenceLength() {
		return maxLength;
	}

	@Override
	public Grammar getGrammar() {
		return grammar;
	}

	public GrammarIndex getIndex() {
		return index;
	}
}
