package edu.uw.easycky.syntax.parser;

import java.util.List;

import edu.uw.easycky.syntax.grammar.Grammar;
import edu.uw.easycky.syntax.grammar.ParseTree;

public interface Parser {

	/**
	 * Returns every parse of the words rooted at the grammar's start symbol. An empty list means the sentence isn't
	 * in the language, or was too long to parse.
	 */
	List<ParseTree> parseTokens(List<String> words);

	int getMaxSentenceLength();

	Grammar getGrammar();
}
