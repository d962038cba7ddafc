package edu.uw.easycky.syntax.grammar;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Splitter;

import edu.uw.easycky.util.Util;

/**
 * Reads grammars written in the NLTK .cfg format:
 *
 * <pre>
 * # comment
 * %start S
 * S -> NP VP
 * N -> 'dog' | 'cat'
 * </pre>
 *
 * Terminals are quoted, nonterminals are bare. Without a %start line, the left-hand side of the first rule is the
 * start symbol. Every alternative must be a single terminal or exactly two nonterminals.
 */
public class GrammarReader {
	private static final String ARROW = "->";
	private static final String START_DIRECTIVE = "%start";

	private GrammarReader() {
	}

	public static Grammar read(final File file) throws IOException {
		return read(Util.readFile(file));
	}

	public static Grammar fromString(final String text) {
		return read(Splitter.on('\n').split(text));
	}

	public static Grammar read(final Iterable<String> lines) {
		String start = null;
		String firstLhs = null;
		final List<Production> productions = new ArrayList<>();

		int lineNumber = 0;
		for (final String line : lines) {
			lineNumber++;
			final List<Token> tokens = tokenize(line, lineNumber);
			if (tokens.isEmpty()) {
				continue;
			}

			final Token first = tokens.get(0);
			if (!first.quoted && first.text.equals(START_DIRECTIVE)) {
				if (tokens.size() != 2 || tokens.get(1).quoted) {
					throw new GrammarFormatException("Expected a single nonterminal after " + START_DIRECTIVE,
							lineNumber);
				}
				start = tokens.get(1).text;
				continue;
			}

			if (tokens.size() < 3 || first.quoted || !tokens.get(1).isArrow()) {
				throw new GrammarFormatException("Expected a rule of the form 'A -> B C' or 'A -> \"w\"'", lineNumber);
			}

			final String lhs = first.text;
			if (firstLhs == null) {
				firstLhs = lhs;
			}

			List<Token> alternative = new ArrayList<>();
			for (final Token token : tokens.subList(2, tokens.size())) {
				if (token.isBar()) {
					productions.add(makeProduction(lhs, alternative, lineNumber));
					alternative = new ArrayList<>();
				} else {
					alternative.add(token);
				}
			}
			productions.add(makeProduction(lhs, alternative, lineNumber));
		}

		if (start == null) {
			start = firstLhs;
		}
		if (start == null) {
			throw new GrammarFormatException("Grammar has no productions", lineNumber);
		}

		return new Grammar(start, productions);
	}

	private static Production makeProduction(final String lhs, final List<Token> rhs, final int lineNumber) {
		if (rhs.size() == 1 && rhs.get(0).quoted) {
			return Production.lexical(lhs, rhs.get(0).text);
		} else if (rhs.size() == 2 && !rhs.get(0).quoted && !rhs.get(1).quoted && !rhs.get(0).isArrow()
				&& !rhs.get(1).isArrow()) {
			return Production.binary(lhs, rhs.get(0).text, rhs.get(1).text);
		}

		throw new GrammarFormatException("Not in Chomsky Normal Form: " + lhs + " -> " + rhs, lineNumber);
	}

	/**
	 * Splits a line into symbols, quoted terminals, arrows and bars. Everything after an unquoted # is ignored.
	 */
	static List<Token> tokenize(final String line, final int lineNumber) {
		final List<Token> result = new ArrayList<>();
		int i = 0;
		while (i < line.length()) {
			final char c = line.charAt(i);
			if (Character.isWhitespace(c)) {
				i++;
			} else if (c == '#') {
				break;
			} else if (c == '\'' || c == '"') {
				final int close = line.indexOf(c, i + 1);
				if (close == -1) {
					throw new GrammarFormatException("Unterminated terminal: " + line.substring(i), lineNumber);
				}
				result.add(new Token(line.substring(i + 1, close), true));
				i = close + 1;
			} else if (c == '|') {
				result.add(new Token("|", false));
				i++;
			} else if (line.startsWith(ARROW, i)) {
				result.add(new Token(ARROW, false));
				i += ARROW.length();
			} else {
				int end = i;
				while (end < line.length() && !Character.isWhitespace(line.charAt(end))
						&& "|'\"#".indexOf(line.charAt(end)) == -1 && !line.startsWith(ARROW, end)) {
					end++;
				}
				result.add(new Token(line.substring(i, end), false));
				i = end;
			}
		}

		return result;
	}

	static class Token {
		final String text;
		final boolean quoted;

		Token(final String text, final boolean quoted) {
			this.text = text;
			this.quoted = quoted;
		}

		boolean isArrow() {
			return !quoted && text.equals(ARROW);
		}

		boolean isBar() {
			return !quoted && text.equals("|");
		}

		@Override
		public String toString() {
			return quoted ? "'" + text + "'" : text;
		}
	}
}
