package org.qargs;

/**
 * Prints a typed value back to the text it would be given as on the command line. Used for command lookup keys and usage text.
 * 
 * @param <T> The type of value to print
 */
@FunctionalInterface
public interface ValuePrinter<T> {
	/**
	 * @param value The value to print
	 * @return The printed value
	 */
	String print(T value);

	/**
	 * @param <T> The type of value to print
	 * @return A printer that uses {@link String#valueOf(Object)}
	 */
	static <T> ValuePrinter<T> toStringPrinter() {
		return String::valueOf;
	}

	/**
	 * @param <E> The enum type
	 * @return A printer that prints an enum constant's {@link Enum#name() name}
	 */
	static <E extends Enum<E>> ValuePrinter<E> enumPrinter() {
		return Enum::name;
	}
}
