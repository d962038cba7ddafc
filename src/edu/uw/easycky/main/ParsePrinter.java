package edu.uw.easycky.main;

import java.util.List;

import com.google.common.base.Strings;

import edu.uw.easycky.syntax.grammar.ParseTree;
import edu.uw.easycky.syntax.grammar.ParseTree.ParseTreeLeaf;
import edu.uw.easycky.syntax.grammar.ParseTree.ParseTreeNode;
import edu.uw.easycky.syntax.grammar.ParseTree.ParseTreeVisitor;

/**
 * Renders the parses of one sentence: the sentence itself, one tree per parse, then the number of parses and a blank
 * line.
 */
public abstract class ParsePrinter {
	public final static ParsePrinter BRACKETED_PRINTER = new BracketedPrinter();
	public final static ParsePrinter INDENTED_PRINTER = new IndentedPrinter();

	public String print(final String sentence, final List<ParseTree> parses) {
		final StringBuilder result = new StringBuilder();
		printHeader(sentence, result);
		for (final ParseTree parse : parses) {
			printParse(parse, result);
			result.append("\n");
		}
		printFooter(parses.size(), result);
		return result.toString();
	}

	/**
	 * Output for a sentence whose parse was abandoned.
	 */
	public String printFailure(final String sentence, final String reason) {
		final StringBuilder result = new StringBuilder();
		printHeader(sentence, result);
		result.append("Parse failed: " + reason + "\n\n");
		return result.toString();
	}

	public String print(final ParseTree parse) {
		final StringBuilder result = new StringBuilder();
		printParse(parse, result);
		return result.toString();
	}

	protected void printHeader(final String sentence, final StringBuilder result) {
		result.append(sentence);
		result.append("\n");
	}

	protected void printFooter(final int numberOfParses, final StringBuilder result) {
		result.append("Number of parses: " + numberOfParses + "\n\n");
	}

	protected abstract void printParse(ParseTree parse, StringBuilder result);

	/**
	 * (S (NP (Det the) (N dog)) (VP (V chased) (NP (Det the) (N cat))))
	 */
	private static class BracketedPrinter extends ParsePrinter {

		@Override
		protected void printParse(final ParseTree parse, final StringBuilder result) {
			parse.accept(new ParseTreeVisitor() {

				@Override
				public void visit(final ParseTreeNode node) {
					result.append("(");
					result.append(node.getSymbol());
					for (final ParseTree child : node.getChildren()) {
						result.append(" ");
						child.accept(this);
					}
					result.append(")");
				}

				@Override
				public void visit(final ParseTreeLeaf node) {
					result.append(node.getWord());
				}
			});
		}
	}

	/**
	 * One constituent per line, children indented by two spaces. Preterminals stay on the line of their word:
	 *
	 * <pre>
	 * (S
	 *   (NP
	 *     (Det the)
	 *     (N dog))
	 *   (VP
	 *     (V chased)
	 *     (NP
	 *       (Det the)
	 *       (N cat))))
	 * </pre>
	 */
	private static class IndentedPrinter extends ParsePrinter {

		@Override
		protected void printParse(final ParseTree parse, final StringBuilder result) {
			parse.accept(new ParseTreeVisitor() {
				private int depth = 0;

				@Override
				public void visit(final ParseTreeNode node) {
					if (node.isPreterminal()) {
						result.append("(" + node.getSymbol() + " " + node.getChild(0).getLabel() + ")");
						return;
					}

					result.append("(");
					result.append(node.getSymbol());
					depth++;
					for (final ParseTree child : node.getChildren()) {
						result.append("\n");
						result.append(Strings.repeat("  ", depth));
						child.accept(this);
					}
					depth--;
					result.append(")");
				}

				@Override
				public void visit(final ParseTreeLeaf node) {
					result.append(node.getWord());
				}
			});
		}
	}
}
