package org.qargs;

import java.text.ParseException;

/**
 * Something the parser can fill with a value parsed from command-line text
 * 
 * @param <T> The type of the parsed value
 */
interface ValueTarget<T> extends Named {
	/** @return The parser for text given to this target */
	ValueParser<T> getParser();

	/** @param value The parsed value to store */
	void fill(T value);

	/**
	 * @param text The command-line text to parse and store
	 * @throws ParseException If the parser rejects the text
	 */
	default void parseAndFill(String text) throws ParseException {
		fill(getParser().parse(text));
	}
}
