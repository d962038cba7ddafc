package edu.uw.easycky.syntax.grammar;

/**
 * Thrown when a grammar file can't be read as a CNF grammar.
 */
public class GrammarFormatException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final int lineNumber;

	public GrammarFormatException(final String message, final int lineNumber) {
		super("Line " + lineNumber + ": " + message);
		this.lineNumber = lineNumber;
	}

	public int getLineNumber() {
		return lineNumber;
	}
}
