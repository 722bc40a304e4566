package org.qargs;

import org.qargs.usage.UsageGroup;

/** A command, owning the {@link ArgumentSet} that parses everything after the command name */
public final class CommandDefinition extends Definition {
	private final ArgumentSet theArgs;

	CommandDefinition(String name, String description, UsageGroup usageGroup, ArgumentSet args) {
		super(name, description, usageGroup);
		theArgs = args;
	}

	@Override
	public Kind getKind() {
		return Kind.COMMAND;
	}

	/** @return A frozen snapshot of the arguments registered for this command */
	public ArgumentSet getArgs() {
		return ArgumentSet.unmodifiable(theArgs);
	}
}
