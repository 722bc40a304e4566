package org.qargs;

import java.text.ParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;

/** Standard {@link ValueParser}s and combinators */
public class ValueParsers {
	private ValueParsers() {}

	/** Returns the text unchanged */
	public static final ValueParser<String> IDENTITY = text -> text;

	/** Parses "true" or "false" */
	public static final ValueParser<Boolean> BOOLEAN = stringChoice(Arrays.asList(Boolean.TRUE, Boolean.FALSE),
		ValuePrinter.toStringPrinter());

	/** Parses a base-10 integer */
	public static final ValueParser<Integer> INT = ints(10);

	/** Parses a base-10 long */
	public static final ValueParser<Long> LONG = text -> {
		try {
			return Long.parseLong(text);
		} catch (NumberFormatException e) {
			throw new ParseException("Invalid long", 0);
		}
	};

	/** Parses a floating-point number */
	public static final ValueParser<Double> DOUBLE = text -> {
		try {
			return Double.parseDouble(text);
		} catch (NumberFormatException e) {
			throw new ParseException("Invalid number", 0);
		}
	};

	/**
	 * @param radix The radix to parse in
	 * @return A parser for integers in the given radix
	 */
	public static ValueParser<Integer> ints(int radix) {
		return text -> {
			try {
				return Integer.parseInt(text, radix);
			} catch (NumberFormatException e) {
				throw new ParseException("Invalid int", 0);
			}
		};
	}

	/**
	 * Creates a parser that maps the printed form of each choice back to the choice
	 * 
	 * @param <T> The type of the choices
	 * @param choices The acceptable values
	 * @param printer The printer producing the text for each choice
	 * @return The parser
	 */
	public static <T> ValueParser<T> stringChoice(List<? extends T> choices, ValuePrinter<? super T> printer) {
		Map<String, T> byText = new LinkedHashMap<>();
		for (T choice : choices)
			byText.put(printer.print(choice), choice);
		return text -> {
			T choice = byText.get(text);
			if (choice == null)
				throw new ParseException("Value not in available choices: " + Joiner.on(", ").join(byText.keySet()), 0);
			return choice;
		};
	}

	/**
	 * @param <E> The enum type
	 * @param type The enum type
	 * @return A parser accepting the {@link Enum#name() names} of the enum's constants
	 */
	public static <E extends Enum<E>> ValueParser<E> enumChoice(Class<E> type) {
		return enumChoice(type, null);
	}

	/**
	 * @param <E> The enum type
	 * @param type The enum type
	 * @param intercept If not null, modifies each constant's name into the text accepted for it (e.g. to lower-case it)
	 * @return A parser accepting the (possibly modified) names of the enum's constants
	 */
	public static <E extends Enum<E>> ValueParser<E> enumChoice(Class<E> type, ValuePrinter<String> intercept) {
		ValuePrinter<E> printer = ValuePrinter.enumPrinter();
		if (intercept != null) {
			ValuePrinter<E> base = printer;
			printer = value -> intercept.print(base.print(value));
		}
		return stringChoice(Arrays.asList(type.getEnumConstants()), printer);
	}

	/**
	 * @param <T> The type of value to parse
	 * @param choices The acceptable values
	 * @param unconstrained The parser to parse values with
	 * @return A parser that rejects values not among the given choices
	 */
	public static <T> ValueParser<T> choice(List<? extends T> choices, ValueParser<T> unconstrained) {
		return unconstrained.choice(choices);
	}

	/**
	 * @param parser The boolean parser to wrap
	 * @return A parser whose result is the negation of the given parser's
	 */
	public static ValueParser<Boolean> negateFlag(ValueParser<Boolean> parser) {
		return parser.then(value -> !value);
	}
}
