package org.qargs;

/**
 * Whether an argument must be given on the command line or is optional with a default value
 * 
 * @param <U> The type of the argument's value
 */
public final class Requirement<U> {
	private static final Requirement<?> MANDATORY = new Requirement<>(true, null);

	private final boolean isMandatory;
	private final U theDefaultValue;

	private Requirement(boolean mandatory, U defaultValue) {
		isMandatory = mandatory;
		theDefaultValue = defaultValue;
	}

	/**
	 * @param <U> The type of the argument's value
	 * @return A requirement that the argument be given
	 */
	@SuppressWarnings("unchecked")
	public static <U> Requirement<U> mandatory() {
		return (Requirement<U>) MANDATORY;
	}

	/**
	 * @param <U> The type of the argument's value
	 * @param defaultValue The value for the argument if it is not given. May be null.
	 * @return A requirement allowing the argument to be omitted
	 */
	public static <U> Requirement<U> optional(U defaultValue) {
		return new Requirement<>(false, defaultValue);
	}

	/** @return Whether the argument must be given */
	public boolean isMandatory() {
		return isMandatory;
	}

	/** @return The default value for the argument, if it is optional */
	public U getDefaultValue() {
		return theDefaultValue;
	}

	@Override
	public String toString() {
		return isMandatory ? "mandatory" : "optional(" + theDefaultValue + ")";
	}
}
