package org.qargs;

import org.qargs.usage.UsageGroup;

/**
 * A named option, possibly with a short alias, possibly a boolean {@link Flag}. Options always have a default value.
 * 
 * @param <T> The type of each parsed value
 * @param <U> The type of the accumulated value
 */
public final class OptionDefinition<T, U> extends ArgumentDefinition<T, U> {
	private final String theValueDescription;
	private final Character theShortName;
	private final Flag theFlag;

	OptionDefinition(String name, String description, String valueDescription, UsageGroup usageGroup, U defaultValue,
		ValueParser<T> parser, ValuePrinter<T> printer, Accumulator<T, U> accumulator, Character shortName, Flag flag) {
		super(name, description, usageGroup, Requirement.optional(defaultValue), parser, printer, accumulator);
		theValueDescription = valueDescription;
		theShortName = shortName;
		theFlag = flag;
	}

	@Override
	public Kind getKind() {
		return Kind.OPTION;
	}

	/** @return A short description of this option's value for usage text, e.g. "FILE", or null */
	public String getValueDescription() {
		return theValueDescription;
	}

	/** @return The single-character alias of this option, or null */
	public Character getShortName() {
		return theShortName;
	}

	/** @return The flag metadata of this option, or null if it is not a flag */
	public Flag getFlag() {
		return theFlag;
	}

	/** @return Whether this option is a boolean flag */
	public boolean isFlag() {
		return theFlag != null;
	}

	/** @return The value of this option when it is not given */
	public U getDefaultValue() {
		return getRequirement().getDefaultValue();
	}
}
