package org.qargs;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Parses the text of a command-line argument into a typed value
 * 
 * @param <T> The type of value produced
 */
@FunctionalInterface
public interface ValueParser<T> {
	/**
	 * @param text The text to parse
	 * @return The parsed value
	 * @throws ParseException If the text cannot be parsed. The exception's message is the human-readable reason.
	 */
	T parse(String text) throws ParseException;

	/**
	 * A function applied to a parsed value which may itself reject the value
	 * 
	 * @param <F> The type of the source value
	 * @param <R> The type of the result
	 */
	@FunctionalInterface
	interface Mapping<F, R> {
		/**
		 * @param value The parsed value
		 * @return The mapped value
		 * @throws ParseException If the value is not acceptable
		 */
		R apply(F value) throws ParseException;
	}

	/**
	 * A test on a parsed value
	 * 
	 * @param <T> The type of the value to check
	 */
	@FunctionalInterface
	interface Check<T> {
		/**
		 * @param value The parsed value
		 * @throws ParseException If the value is not acceptable
		 */
		void check(T value) throws ParseException;
	}

	/**
	 * @param <R> The type of the result
	 * @param next The function to apply to values parsed by this parser
	 * @return A parser that parses with this parser, then applies the given function to the result
	 */
	default <R> ValueParser<R> then(Mapping<? super T, ? extends R> next) {
		return text -> next.apply(parse(text));
	}

	/**
	 * @param check The check to run on each parsed value
	 * @return A parser that parses with this parser, runs the check, then returns the value unchanged
	 */
	default ValueParser<T> also(Check<? super T> check) {
		return then(value -> {
			check.check(value);
			return value;
		});
	}

	/**
	 * @param choices The values that are acceptable
	 * @return A parser that rejects any value parsed by this parser that is not one of the given choices
	 */
	default ValueParser<T> choice(Collection<? extends T> choices) {
		return choice(choices, ValuePrinter.toStringPrinter());
	}

	/**
	 * @param choices The values that are acceptable
	 * @param printer The printer to describe the choices in the error message
	 * @return A parser that rejects any value parsed by this parser that is not one of the given choices
	 */
	default ValueParser<T> choice(Collection<? extends T> choices, ValuePrinter<? super T> printer) {
		List<T> copy = new ArrayList<>(choices);
		return also(value -> {
			if (!copy.contains(value)) {
				List<String> printed = new ArrayList<>(copy.size());
				for (T choice : copy)
					printed.add(printer.print(choice));
				throw new ParseException("Value not in available choices: " + Joiner.on(", ").join(printed), 0);
			}
		});
	}
}
