package org.qargs;

/** Registers the arguments of one command. Returned by {@link CommandSet#addCommand(Object)}. */
public class CommandParser extends ArgParser {
	private final CommandDefinition theCommand;

	CommandParser(ArgParser parent, CommandDefinition command, ArgumentRegistry registry) {
		super(parent.getInfo(), parent.getUsageContext().subCommand(command), parent.getUsagePrinter(), registry);
		theCommand = command;
	}

	/** @return The definition of this parser's command */
	public CommandDefinition getCommand() {
		return theCommand;
	}
}
