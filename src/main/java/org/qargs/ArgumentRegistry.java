package org.qargs;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.log4j.Logger;
import org.qargs.usage.UsageGroup;

/**
 * Registers arguments into one scope's {@link ArgumentSet}, validating the schema as it is built. Every violation is reported
 * immediately with an {@link ArgDefinitionException}.
 */
public class ArgumentRegistry {
	private static final Logger log = Logger.getLogger(ArgumentRegistry.class);

	private final ArgConfig theConfig;
	private final ArgumentSet theArgs;
	private final Set<UsageGroup> theUsageGroups;

	/** @param config The config for parsing the arguments registered here */
	public ArgumentRegistry(ArgConfig config) {
		this(config, new ArgumentSet());
	}

	private ArgumentRegistry(ArgConfig config, ArgumentSet args) {
		theConfig = config;
		theArgs = args;
		theUsageGroups = new LinkedHashSet<>();
	}

	/**
	 * @param parent The registry of the scope a command is being added to
	 * @return A registry for the command, whose arguments start as a snapshot of the parent's positionals and options
	 */
	static ArgumentRegistry subCommand(ArgumentRegistry parent) {
		return new ArgumentRegistry(parent.theConfig, ArgumentSet.subCommand(parent.theArgs));
	}

	/** @return The config for parsing the arguments registered here */
	public ArgConfig getConfig() {
		return theConfig;
	}

	/** @return A frozen snapshot of the arguments registered so far */
	public ArgumentSet getArgs() {
		return ArgumentSet.unmodifiable(theArgs);
	}

	/** @return The usage groups created in this registry */
	public Set<UsageGroup> getUsageGroups() {
		return Collections.unmodifiableSet(theUsageGroups);
	}

	/**
	 * @param name The name of the group
	 * @return The new usage group
	 * @throws ArgDefinitionException If a group with the given name was already created here
	 */
	public UsageGroup createUsageGroup(String name) throws ArgDefinitionException {
		UsageGroup group = new UsageGroup(name);
		if (!theUsageGroups.add(group))
			throw new ArgDefinitionException(name, "Duplicate usage group");
		return group;
	}

	/**
	 * @param <T> The type of each parsed value
	 * @param <U> The type of the accumulated value
	 * @param name The name of the positional
	 * @param description The description for usage text, or null
	 * @param usageGroup The usage group, or null
	 * @param requirement Whether the positional must be given. Null means mandatory.
	 * @param parser The parser for the positional's text
	 * @param printer The printer for the positional's values, or null to use {@link ValuePrinter#toStringPrinter()}
	 * @param accumulator The accumulator for the positional's values
	 * @param multi Whether the positional consumes all remaining positional text
	 * @param noOptionsFollowing Whether options stop being recognized after this positional, or null to use the config's policy
	 * @return The holder for the positional's value
	 * @throws ArgDefinitionException If the name is a duplicate, a mandatory positional would follow an optional one, or the last
	 *         positional registered is multi-valued
	 */
	public <T, U> Arg<U> addPositional(String name, String description, UsageGroup usageGroup, Requirement<U> requirement,
		ValueParser<T> parser, ValuePrinter<T> printer, Accumulator<T, U> accumulator, boolean multi, Boolean noOptionsFollowing)
		throws ArgDefinitionException {
		checkName(name);
		for (PositionalDefinition<?, ?> positional : theArgs.getPositionals()) {
			if (positional.getName().equals(name))
				throw new ArgDefinitionException(name, "Duplicate argument");
		}
		if (requirement == null)
			requirement = Requirement.mandatory();

		if (!theArgs.getPositionals().isEmpty()) {
			PositionalDefinition<?, ?> last = theArgs.getPositionals().get(theArgs.getPositionals().size() - 1);
			if (!last.getRequirement().isMandatory() && requirement.isMandatory())
				throw new ArgDefinitionException(name, "Mandatory positionals cannot come after optional ones");
			if (last.isMulti())
				throw new ArgDefinitionException(name, "A multi-valued positional argument must be last");
		}

		PositionalDefinition<T, U> def = new PositionalDefinition<>(name, description, usageGroup, requirement, parser,
			printer == null ? ValuePrinter.toStringPrinter() : printer, accumulator, multi, noOptionsFollowing);
		theArgs.addPositional(def);
		return def.getValueHolder();
	}

	/**
	 * @param <T> The type of each parsed value
	 * @param <U> The type of the accumulated value
	 * @param name The long name of the option
	 * @param description The description for usage text, or null
	 * @param valueDescription The description of the option's value for usage text, or null
	 * @param usageGroup The usage group, or null
	 * @param shortName The single-character alias of the option, or null
	 * @param flag Null if the option is not a flag, otherwise how the flag's inverse name is determined
	 * @param defaultValue The value of the option if it is not given
	 * @param parser The parser for the option's values
	 * @param printer The printer for the option's values, or null to use {@link ValuePrinter#toStringPrinter()}
	 * @param accumulator The accumulator for the option's values
	 * @return The holder for the option's value
	 * @throws ArgDefinitionException If the long name, short alias or inverse name is a duplicate, or the short alias is not a single
	 *         character
	 */
	public <T, U> Arg<U> addOption(String name, String description, String valueDescription, UsageGroup usageGroup, String shortName,
		FlagInverse flag, U defaultValue, ValueParser<T> parser, ValuePrinter<T> printer, Accumulator<T, U> accumulator)
		throws ArgDefinitionException {
		checkName(name);
		if (theArgs.getOptions().containsKey(name))
			throw new ArgDefinitionException(name, "Duplicate argument");
		Character shortChar = null;
		if (shortName != null) {
			if (shortName.length() != 1)
				throw new ArgDefinitionException(shortName, "Must be a single character");
			shortChar = shortName.charAt(0);
			if (theArgs.getShortToLong().containsKey(shortChar))
				throw new ArgDefinitionException(shortName, "Duplicate argument");
		}

		Flag resolvedFlag = null;
		if (flag != null) {
			String inverse;
			switch (flag.getMode()) {
			case NAMED:
				inverse = flag.getName();
				break;
			case AUTO:
				inverse = theConfig.getInverseGenerator().generate(name);
				if (inverse != null && log.isDebugEnabled())
					log.debug("Generated inverse \"" + inverse + "\" for flag \"" + name + "\"");
				break;
			default:
				inverse = null;
				break;
			}
			if (inverse != null && (inverse.equals(name) || theArgs.getOptions().containsKey(inverse)))
				throw new ArgDefinitionException(inverse, "Duplicate argument");
			resolvedFlag = new Flag(inverse);
		}

		OptionDefinition<T, U> def = new OptionDefinition<>(name, description, valueDescription, usageGroup, defaultValue, parser,
			printer == null ? ValuePrinter.toStringPrinter() : printer, accumulator, shortChar, resolvedFlag);
		theArgs.putOption(name, def);
		if (resolvedFlag != null && resolvedFlag.getInverse() != null)
			theArgs.putOption(resolvedFlag.getInverse(), def);
		if (shortChar != null)
			theArgs.putShort(shortChar, name);
		return def.getValueHolder();
	}

	/**
	 * @param <T> The type of the command identifiers
	 * @param parser The parser for command identifiers
	 * @param printer The printer producing each command's name from its identifier
	 * @return A registry to add commands with
	 * @throws ArgDefinitionException If this scope already has a command set
	 */
	public <T> CommandSetRegistry<T> addCommands(ValueParser<T> parser, ValuePrinter<T> printer) throws ArgDefinitionException {
		if (theArgs.getCommandSet() != null)
			throw new ArgDefinitionException("command", "Already added a command set");
		CommandSetDefinition<T> commandSet = new CommandSetDefinition<>(parser, printer);
		theArgs.setCommandSet(commandSet);
		return new CommandSetRegistry<>(this, commandSet);
	}

	private static void checkName(String name) {
		if (name == null || name.isEmpty())
			throw new ArgDefinitionException(String.valueOf(name), "Argument name must not be empty");
	}

	/**
	 * Adds commands to a scope
	 * 
	 * @param <T> The type of the command identifiers
	 */
	public static class CommandSetRegistry<T> {
		private final ArgumentRegistry theParent;
		private final CommandSetDefinition<T> theCommandSet;

		CommandSetRegistry(ArgumentRegistry parent, CommandSetDefinition<T> commandSet) {
			theParent = parent;
			theCommandSet = commandSet;
		}

		/** @return The command set definition */
		public CommandSetDefinition<T> getCommandSet() {
			return theCommandSet;
		}

		/**
		 * @param id The identifier of the command. Its printed form is the command's name.
		 * @param description The description for usage text, or null
		 * @param usageGroup The usage group, or null
		 * @return The command's definition and the registry for its own arguments
		 * @throws ArgDefinitionException If a command with the same name was already added
		 */
		public AddedCommand addCommand(T id, String description, UsageGroup usageGroup) throws ArgDefinitionException {
			String name = theCommandSet.getPrinter().print(id);
			if (theParent.theArgs.getCommands().containsKey(name))
				throw new ArgDefinitionException(name, "Duplicate command");
			ArgumentRegistry sub = ArgumentRegistry.subCommand(theParent);
			CommandDefinition command = new CommandDefinition(name, description, usageGroup, sub.theArgs);
			theParent.theArgs.putCommand(name, command);
			return new AddedCommand(sub, command);
		}
	}

	/** A command just added to a {@link CommandSetRegistry} */
	public static class AddedCommand {
		private final ArgumentRegistry theRegistry;
		private final CommandDefinition theCommand;

		AddedCommand(ArgumentRegistry registry, CommandDefinition command) {
			theRegistry = registry;
			theCommand = command;
		}

		/** @return The registry for the command's own arguments */
		public ArgumentRegistry getRegistry() {
			return theRegistry;
		}

		/** @return The command's definition */
		public CommandDefinition getCommand() {
			return theCommand;
		}
	}
}
