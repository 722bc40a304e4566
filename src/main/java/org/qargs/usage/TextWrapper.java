package org.qargs.usage;

import java.util.ArrayList;
import java.util.List;

/** Breaks text into lines no wider than a given width */
@FunctionalInterface
public interface TextWrapper {
	/** Wraps on whitespace, splitting words longer than the width */
	TextWrapper DEFAULT = TextWrapper::wrapWords;

	/**
	 * @param text The text to wrap. Newlines in it are kept.
	 * @param width The maximum line width
	 * @return The wrapped lines
	 */
	List<String> wrap(String text, int width);

	/**
	 * @param text The text to wrap
	 * @param width The maximum line width
	 * @return The lines of the text, broken on whitespace, with words longer than the width broken into pieces
	 */
	static List<String> wrapWords(String text, int width) {
		List<String> lines = new ArrayList<>();
		for (String line : text.split("\n", -1)) {
			if (line.length() < width) {
				lines.add(line);
				continue;
			}

			StringBuilder buffer = new StringBuilder();
			for (String word : line.split("\\s+")) {
				if (word.isEmpty())
					continue;
				boolean needsSpace = buffer.length() > 0;
				if (width - buffer.length() < word.length() + (needsSpace ? 1 : 0)) {
					if (buffer.length() > 0)
						lines.add(buffer.toString());
					buffer.setLength(0);
					needsSpace = false;
					while (word.length() > width) {
						lines.add(word.substring(0, width));
						word = word.substring(width);
					}
				}
				if (needsSpace)
					buffer.append(' ');
				buffer.append(word);
			}
			if (buffer.length() > 0)
				lines.add(buffer.toString());
		}
		return lines;
	}
}
