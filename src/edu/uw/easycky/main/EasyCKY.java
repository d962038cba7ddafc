package edu.uw.easycky.main;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.text.DecimalFormat;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.InputMismatchException;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import uk.co.flamingpenguin.jewel.cli.ArgumentValidationException;
import uk.co.flamingpenguin.jewel.cli.CliFactory;
import uk.co.flamingpenguin.jewel.cli.Option;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;

import edu.uw.easycky.syntax.grammar.Grammar;
import edu.uw.easycky.syntax.grammar.GrammarReader;
import edu.uw.easycky.syntax.grammar.ParseTree;
import edu.uw.easycky.syntax.parser.ChartSizeExceededException;
import edu.uw.easycky.syntax.parser.Parser;
import edu.uw.easycky.syntax.parser.ParserCKY;
import edu.uw.easycky.util.Util;

public class EasyCKY {

	/**
	 * Command Line Interface
	 */
	public interface CommandLineArguments {
		@Option(shortName = "g", description = "Path to the grammar, in NLTK .cfg format and Chomsky Normal Form")
		String getGrammar();

		@Option(shortName = "f", defaultValue = "", description = "(Optional) Path to the input text file, one sentence per line. Otherwise, the parser will read from stdin.")
		String getInputFile();

		@Option(shortName = "o", defaultValue = "", description = "(Optional) Path to the output file. Otherwise, parses are written to stdout.")
		String getOutputFile();

		@Option(shortName = "i", defaultValue = "raw", description = "(Optional) Input Format: one of \"raw\" (plain text) or \"tokenized\" (whitespace separated tokens). Defaults to raw.")
		String getInputFormat();

		@Option(defaultValue = "bracketed", description = "(Optional) Output Format: one of \"bracketed\" or \"indented\". Defaults to bracketed.")
		String getOutputFormat();

		@Option(shortName = "l", defaultValue = "70", description = "(Optional) Maximum length of sentences in words. Longer sentences get no parses. Defaults to 70.")
		int getMaxLength();

		@Option(defaultValue = "1000000", description = "(Optional) Maximum number of chart entries per sentence. Sentences that need more are reported as failures. Defaults to 1000000.")
		int getMaxChartSize();

		@Option(shortName = "t", defaultValue = "1", description = "(Optional) Number of sentences to parse in parallel. Defaults to 1.")
		int getThreads();

		@Option(helpRequest = true, description = "Display this message", shortName = "h")
		boolean getHelp();
	}

	// Set of supported InputFormats
	public enum InputFormat {
		RAW, TOKENIZED
	}

	// Set of supported OutputFormats
	public enum OutputFormat {
		BRACKETED(ParsePrinter.BRACKETED_PRINTER), INDENTED(ParsePrinter.INDENTED_PRINTER);

		public final ParsePrinter printer;

		OutputFormat(final ParsePrinter printer) {
			this.printer = printer;
		}
	}

	public static void main(final String[] args) throws IOException, InterruptedException {
		try {
			final CommandLineArguments commandLineOptions = CliFactory.parseArguments(CommandLineArguments.class, args);
			final InputFormat inputFormat = InputFormat.valueOf(commandLineOptions.getInputFormat().toUpperCase());
			final OutputFormat outputFormat = OutputFormat.valueOf(commandLineOptions.getOutputFormat().toUpperCase());
			final File grammarFile = Util.getFile(commandLineOptions.getGrammar());
			if (!grammarFile.exists()) {
				throw new InputMismatchException("Couldn't load grammar from: " + grammarFile);
			}

			System.err.println("====Loading grammar====");
			final Grammar grammar = GrammarReader.read(grammarFile);
			final Parser parser = new ParserCKY.Builder(grammar)
					.maximumSentenceLength(commandLineOptions.getMaxLength())
					.maxChartSize(commandLineOptions.getMaxChartSize()).build();
			System.err.println("===Grammar loaded: " + grammar.size() + " productions, start symbol "
					+ grammar.getStart() + "===");

			final boolean readingFromStdin = commandLineOptions.getInputFile().isEmpty();
			final Iterator<String> inputLines;
			if (readingFromStdin) {
				inputLines = Util.readLines(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
			} else {
				inputLines = Util.readFile(Util.getFile(commandLineOptions.getInputFile())).iterator();
			}

			final Writer output;
			if (commandLineOptions.getOutputFile().isEmpty()) {
				output = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
			} else {
				output = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(Util.getFile(commandLineOptions
						.getOutputFile())), StandardCharsets.UTF_8));
			}

			final Stopwatch timer = Stopwatch.createStarted();
			final int parsedSentences;
			try {
				parsedSentences = parseAll(parser, InputReader.make(inputFormat), outputFormat.printer, inputLines,
						output, commandLineOptions.getThreads(), readingFromStdin);
			} finally {
				output.close();
			}

			final DecimalFormat twoDP = new DecimalFormat("#.##");
			System.err.println("Sentences parsed: " + parsedSentences);
			System.err.println("Speed: "
					+ twoDP.format(1000.0 * parsedSentences / Math.max(1, timer.elapsed(TimeUnit.MILLISECONDS)))
					+ " sentences per second");

		} catch (final ArgumentValidationException e) {
			System.err.println(e.getMessage());
			System.err.println(CliFactory.createCli(CommandLineArguments.class).getHelpMessage());
		}
	}

	/**
	 * Parses every sentence in the input, and writes the results in input order. Sentences are parsed on a pool of
	 * numThreads threads; they share the parser, and each gets its own chart.
	 *
	 * @return the number of sentences parsed
	 */
	public static int parseAll(final Parser parser, final InputReader reader, final ParsePrinter printer,
			final Iterator<String> inputLines, final Writer output, final int numThreads, final boolean flushEachSentence)
			throws IOException, InterruptedException {
		final ExecutorService executorService = Executors.newFixedThreadPool(Math.max(1, numThreads));
		final Deque<Future<String>> pending = new ArrayDeque<>();
		final int maxPending = 4 * Math.max(1, numThreads);
		int sentences = 0;

		try {
			while (inputLines.hasNext()) {
				final String line = inputLines.next().trim();
				if (!InputReader.isSentence(line)) {
					continue;
				}

				sentences++;
				pending.add(executorService.submit(() -> parseSentence(parser, reader, printer, line)));

				// Write out whatever is finished at the head of the queue, so output stays in input order.
				while (!pending.isEmpty()
						&& (flushEachSentence || pending.size() > maxPending || pending.peek().isDone())) {
					write(pending.poll(), output, flushEachSentence);
				}
			}

			while (!pending.isEmpty()) {
				write(pending.poll(), output, flushEachSentence);
			}
		} finally {
			executorService.shutdownNow();
		}
		output.flush();

		return sentences;
	}

	static String parseSentence(final Parser parser, final InputReader reader, final ParsePrinter printer,
			final String line) {
		try {
			final List<ParseTree> parses = parser.parseTokens(reader.readInput(line));
			return printer.print(line, parses);
		} catch (final ChartSizeExceededException e) {
			System.err.println(e.getMessage() + ": " + line);
			return printer.printFailure(line, e.getMessage());
		}
	}

	private static void write(final Future<String> result, final Writer output, final boolean flush)
			throws IOException, InterruptedException {
		try {
			output.write(result.get());
		} catch (final ExecutionException e) {
			Throwables.throwIfUnchecked(e.getCause());
			throw new RuntimeException(e.getCause());
		}
		if (flush) {
			output.flush();
		}
	}
}
