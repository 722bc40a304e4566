package org.qargs;

/**
 * Mutable slot for a value that is only known once command-line arguments are parsed. A holder is either filled (possibly with null)
 * or empty, and reading an empty holder is an error.
 * 
 * @param <T> The type of the value
 */
public class ValueHolder<T> {
	private boolean isSet;
	private T theValue;

	/** Creates an empty holder */
	ValueHolder() {}

	/** @param value The initial value for the holder */
	ValueHolder(T value) {
		theValue = value;
		isSet = true;
	}

	/** @return Whether this holder has a value, either an initial one or one given on the command line */
	public boolean isFilled() {
		return isSet;
	}

	/**
	 * @return The held value
	 * @throws IllegalStateException If this holder is empty, typically because arguments have not been parsed yet
	 */
	public T get() throws IllegalStateException {
		if (!isSet)
			throw new IllegalStateException("Empty value: arguments have not been parsed");
		return theValue;
	}

	/** @return The held value, or null if this holder is empty */
	T getOrNull() {
		return theValue;
	}

	void fill(T value) {
		isSet = true;
		theValue = value;
	}

	@Override
	public String toString() {
		if (!isSet)
			return "<empty>";
		else
			return String.valueOf(theValue);
	}
}
