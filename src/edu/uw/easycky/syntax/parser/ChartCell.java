package edu.uw.easycky.syntax.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * All nodes found for one span, in the order they were found. Several entries may share a label.
 */
public class ChartCell {
	private final int start;
	private final int end;
	private final List<ParseForestNode> entries = new ArrayList<>();

	ChartCell(final int start, final int end) {
		this.start = start;
		this.end = end;
	}

	void add(final ParseForestNode entry) {
		Preconditions.checkArgument(entry.getStartOfSpan() == start && entry.getEndOfSpan() == end,
				"Node %s doesn't belong in cell (%s,%s)", entry, start, end);
		entries.add(entry);
	}

	public List<ParseForestNode> getEntries() {
		return Collections.unmodifiableList(entries);
	}

	public int size() {
		return entries.size();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public int getStartOfSpan() {
		return start;
	}

	public int getEndOfSpan() {
		return end;
	}
}
