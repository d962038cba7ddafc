package edu.uw.easycky.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

public class Util {

	public static File getFile(final String path) {
		return new File(path.replace("~", System.getProperty("user.home")));
	}

	public static Iterable<String> readFile(final File filePath) throws IOException {
		if (!filePath.exists()) {
			throw new IOException("File not found: " + filePath);
		}

		return new Iterable<String>() {

			@Override
			public Iterator<String> iterator() {
				try {
					return readFileLineByLine(filePath);
				} catch (final IOException e) {
					throw new UncheckedIOException(e);
				}
			}
		};
	}

	/**
	 * Lines of a UTF-8 file. Files ending in .gz are unzipped on the fly. The file is closed once the last line has
	 * been read.
	 */
	public static Iterator<String> readFileLineByLine(final File filePath) throws IOException {
		InputStream stream = new FileInputStream(filePath);
		if (filePath.getName().endsWith(".gz")) {
			stream = new GZIPInputStream(stream);
		}
		return readLines(new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)));
	}

	public static Iterator<String> readLines(final BufferedReader br) throws IOException {
		final String first = br.readLine();
		if (first == null) {
			br.close();
		}

		return new Iterator<String>() {
			String next = first;

			@Override
			public boolean hasNext() {
				return next != null;
			}

			@Override
			public String next() {
				if (next == null) {
					throw new NoSuchElementException();
				}
				final String result = next;
				try {
					next = br.readLine();
					if (next == null) {
						br.close();
					}
				} catch (final IOException e) {
					throw new UncheckedIOException(e);
				}
				return result;
			}
		};
	}
}
