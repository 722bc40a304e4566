package org.qargs;

import org.qargs.usage.UsageGroup;

/**
 * A registered element of an {@link ArgumentSet}. The set of subclasses is closed: {@link PositionalDefinition},
 * {@link OptionDefinition} and {@link CommandDefinition}, distinguished by {@link #getKind()}.
 */
public abstract class Definition implements Named {
	/** The kinds of definition */
	public enum Kind {
		/** A {@link PositionalDefinition} */
		POSITIONAL,
		/** An {@link OptionDefinition} */
		OPTION,
		/** A {@link CommandDefinition} */
		COMMAND
	}

	private final String theName;
	private final String theDescription;
	private final UsageGroup theUsageGroup;

	Definition(String name, String description, UsageGroup usageGroup) {
		theName = name;
		theDescription = description;
		theUsageGroup = usageGroup;
	}

	/** @return Which kind of definition this is */
	public abstract Kind getKind();

	@Override
	public String getName() {
		return theName;
	}

	/** @return The description of this definition for usage text, or null */
	public String getDescription() {
		return theDescription;
	}

	/** @return The group this definition is listed under in usage text, or null for the default group for its kind */
	public UsageGroup getUsageGroup() {
		return theUsageGroup;
	}

	@Override
	public String toString() {
		return theName;
	}
}
