package org.qargs;

/**
 * Immutable policy for how command-line tokens are recognized. Modify with the <code>with*</code> methods, which return copies.
 */
public final class ArgConfig {
	/** Long options start with "--", short options with "-", "--" stops option recognition, and flags have no generated inverses */
	public static final ArgConfig DEFAULT = new ArgConfig("--", "-", "--", false, InverseGenerator.NONE);

	/**
	 * Options start with a single "-" and there are no short options, so "-ab" names the option "ab". Mirrors the conventions of the Go
	 * flag package.
	 */
	public static final ArgConfig GO = new ArgConfig("-", null, "--", false, InverseGenerator.NONE);

	private final String theLongPrefix;
	private final String theShortPrefix;
	private final String theDisableOptionsAfter;
	private final boolean isNoOptionsAfterPositional;
	private final InverseGenerator theInverseGenerator;

	private ArgConfig(String longPrefix, String shortPrefix, String disableOptionsAfter, boolean noOptionsAfterPositional,
		InverseGenerator inverseGenerator) {
		if (longPrefix == null || longPrefix.isEmpty())
			throw new IllegalArgumentException("Long option prefix must not be empty");
		if (shortPrefix != null && shortPrefix.isEmpty())
			throw new IllegalArgumentException("Short option prefix must be null or non-empty");
		theLongPrefix = longPrefix;
		theShortPrefix = shortPrefix;
		theDisableOptionsAfter = disableOptionsAfter;
		isNoOptionsAfterPositional = noOptionsAfterPositional;
		theInverseGenerator = inverseGenerator == null ? InverseGenerator.NONE : inverseGenerator;
	}

	/** @return The prefix introducing a long option */
	public String getLongPrefix() {
		return theLongPrefix;
	}

	/** @return The prefix introducing a cluster of short options, or null if short options are not recognized */
	public String getShortPrefix() {
		return theShortPrefix;
	}

	/** @return The token after which options are no longer recognized, or null if there is no such token */
	public String getDisableOptionsAfter() {
		return theDisableOptionsAfter;
	}

	/** @return Whether options stop being recognized after any positional that does not override this */
	public boolean isNoOptionsAfterPositional() {
		return isNoOptionsAfterPositional;
	}

	/** @return The generator for inverse flag names */
	public InverseGenerator getInverseGenerator() {
		return theInverseGenerator;
	}

	/**
	 * @param longPrefix The prefix introducing a long option
	 * @return A copy of this config with the given long prefix
	 */
	public ArgConfig withLongPrefix(String longPrefix) {
		return new ArgConfig(longPrefix, theShortPrefix, theDisableOptionsAfter, isNoOptionsAfterPositional, theInverseGenerator);
	}

	/**
	 * @param shortPrefix The prefix introducing short options, or null to disable short options
	 * @return A copy of this config with the given short prefix
	 */
	public ArgConfig withShortPrefix(String shortPrefix) {
		return new ArgConfig(theLongPrefix, shortPrefix, theDisableOptionsAfter, isNoOptionsAfterPositional, theInverseGenerator);
	}

	/**
	 * @param disableOptionsAfter The token after which options are no longer recognized, or null for none
	 * @return A copy of this config with the given separator
	 */
	public ArgConfig withDisableOptionsAfter(String disableOptionsAfter) {
		return new ArgConfig(theLongPrefix, theShortPrefix, disableOptionsAfter, isNoOptionsAfterPositional, theInverseGenerator);
	}

	/**
	 * @param noOptionsAfterPositional Whether options stop being recognized after the first positional
	 * @return A copy of this config with the given policy
	 */
	public ArgConfig withNoOptionsAfterPositional(boolean noOptionsAfterPositional) {
		return new ArgConfig(theLongPrefix, theShortPrefix, theDisableOptionsAfter, noOptionsAfterPositional, theInverseGenerator);
	}

	/**
	 * @param inverseGenerator The generator for inverse flag names
	 * @return A copy of this config with the given generator
	 */
	public ArgConfig withInverseGenerator(InverseGenerator inverseGenerator) {
		return new ArgConfig(theLongPrefix, theShortPrefix, theDisableOptionsAfter, isNoOptionsAfterPositional, inverseGenerator);
	}

	@Override
	public String toString() {
		return "ArgConfig(long=" + theLongPrefix + ", short=" + theShortPrefix + ", disableOptionsAfter=" + theDisableOptionsAfter
			+ ", noOptionsAfterPositional=" + isNoOptionsAfterPositional + ")";
	}
}
