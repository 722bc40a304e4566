package org.qargs;

import org.qargs.usage.UsageGroup;

/**
 * A positional argument, filled by command-line text in order
 * 
 * @param <T> The type of each parsed value
 * @param <U> The type of the accumulated value
 */
public final class PositionalDefinition<T, U> extends ArgumentDefinition<T, U> {
	private final boolean isMulti;
	private final Boolean theNoOptionsFollowing;

	PositionalDefinition(String name, String description, UsageGroup usageGroup, Requirement<U> requirement, ValueParser<T> parser,
		ValuePrinter<T> printer, Accumulator<T, U> accumulator, boolean multi, Boolean noOptionsFollowing) {
		super(name, description, usageGroup, requirement, parser, printer, accumulator);
		isMulti = multi;
		theNoOptionsFollowing = noOptionsFollowing;
	}

	@Override
	public Kind getKind() {
		return Kind.POSITIONAL;
	}

	/** @return Whether this positional consumes all remaining positional text */
	public boolean isMulti() {
		return isMulti;
	}

	/**
	 * @return Whether options stop being recognized once this positional is given, or null to use
	 *         {@link ArgConfig#isNoOptionsAfterPositional() the config's policy}
	 */
	public Boolean getNoOptionsFollowing() {
		return theNoOptionsFollowing;
	}
}
