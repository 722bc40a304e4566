package org.qargs;

/**
 * Holds the eventual value of a registered positional or option
 * 
 * @param <T> The type of the value
 */
public class Arg<T> extends ValueHolder<T> implements Named {
	private final String theName;
	private boolean wasGiven;

	Arg(String name) {
		theName = name;
	}

	Arg(String name, T defaultValue) {
		super(defaultValue);
		theName = name;
	}

	@Override
	public String getName() {
		return theName;
	}

	/** @return Whether this argument was given on the command line. If false, {@link #get()} returns the default. */
	public boolean wasGiven() {
		return wasGiven;
	}

	void markGiven() {
		wasGiven = true;
	}
}
