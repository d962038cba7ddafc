package edu.uw.easycky.main;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import edu.uw.easycky.main.EasyCKY.InputFormat;

/**
 * Turns a line of input into the tokens the parser matches against terminals.
 */
public abstract class InputReader {

	public abstract List<String> readInput(String line);

	/**
	 * Lines that are empty or start with # are not sentences.
	 */
	public static boolean isSentence(final String line) {
		final String trimmed = line.trim();
		return !trimmed.isEmpty() && !trimmed.startsWith("#");
	}

	public static InputReader make(final InputFormat inputFormat) {
		switch (inputFormat) {
		case TOKENIZED:
			return new TokenizedInputReader();
		case RAW:
			return new RawInputReader();
		default:
			throw new IllegalArgumentException("Unknown input format: " + inputFormat);
		}
	}

	/**
	 * Input that is already tokenized, with tokens separated by whitespace.
	 */
	private static class TokenizedInputReader extends InputReader {
		private final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

		@Override
		public List<String> readInput(final String line) {
			return splitter.splitToList(line);
		}
	}

	/**
	 * Plain text. Splits off punctuation, and clitics such as n't and 's, in the style of the Penn Treebank.
	 */
	private static class RawInputReader extends InputReader {
		private static final Pattern NEGATION = Pattern.compile("(?i)(\\p{L})(n't)\\b");
		private static final Pattern CLITIC = Pattern.compile("(?i)([\\p{L}\\p{N}])('(?:s|re|ve|ll|d|m))\\b");
		private static final Pattern TOKEN = Pattern.compile("(?i)n't|'(?:s|re|ve|ll|d|m)\\b"
				+ "|[\\p{L}\\p{N}]+(?:(?:[-.']|(?<=\\p{N}),(?=\\p{N}))[\\p{L}\\p{N}]+)*|\\.\\.\\.|--|\\S");

		@Override
		public List<String> readInput(final String line) {
			String text = NEGATION.matcher(line).replaceAll("$1 $2");
			text = CLITIC.matcher(text).replaceAll("$1 $2");

			final List<String> result = new ArrayList<>();
			final Matcher matcher = TOKEN.matcher(text);
			while (matcher.find()) {
				result.add(matcher.group());
			}
			return result;
		}
	}
}
