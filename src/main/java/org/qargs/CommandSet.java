package org.qargs;

import org.qargs.usage.UsageGroup;

/**
 * The commands of an {@link ArgParser}, exactly one of which must be given
 * 
 * @param <T> The type of the command identifiers
 */
public class CommandSet<T> {
	private final ArgParser theParent;
	private final ArgumentRegistry.CommandSetRegistry<T> theRegistry;

	CommandSet(ArgParser parent, ArgumentRegistry.CommandSetRegistry<T> registry) {
		theParent = parent;
		theRegistry = registry;
	}

	/** @return The parser this command set belongs to */
	public ArgParser getParent() {
		return theParent;
	}

	/**
	 * @param id The identifier of the command
	 * @return The parser for the command's own arguments
	 */
	public CommandParser addCommand(T id) {
		return addCommand(id, null, null);
	}

	/**
	 * @param id The identifier of the command
	 * @param description The description for usage text, or null
	 * @param usageGroup The group to list the command under in usage text, or null
	 * @return The parser for the command's own arguments. It inherits the positionals and options registered in the parent so far.
	 * @throws ArgDefinitionException If a command with the same name was already added
	 */
	public CommandParser addCommand(T id, String description, UsageGroup usageGroup) throws ArgDefinitionException {
		ArgumentRegistry.AddedCommand added = theRegistry.addCommand(id, description, usageGroup);
		CommandParser parser = new CommandParser(theParent, added.getCommand(), added.getRegistry());
		theParent.registerCommandParser(added.getCommand().getName(), parser);
		return parser;
	}

	/** @return Whether a command has been parsed */
	public boolean isSelected() {
		return theRegistry.getCommandSet().getValueHolder().isFilled();
	}

	/**
	 * @return The identifier of the command that was given
	 * @throws IllegalStateException If arguments have not been parsed
	 */
	public T getSelected() throws IllegalStateException {
		return theRegistry.getCommandSet().getValueHolder().get();
	}
}
