package org.qargs;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Everything that can be parsed in one scope: the root of a command line, or everything after a command name. Indexes options by long
 * name (an inverse flag name is a second key for the same definition) and by short alias.
 * <p>
 * A set is mutable while arguments are registered into it, then {@link #unmodifiable(ArgumentSet) frozen} for parsing.
 * </p>
 */
public class ArgumentSet {
	private final List<PositionalDefinition<?, ?>> thePositionals;
	private final Map<String, OptionDefinition<?, ?>> theOptions;
	private final Map<Character, String> theShortToLong;
	private final Map<String, CommandDefinition> theCommands;
	private CommandSetDefinition<?> theCommandSet;
	private final boolean isMutable;

	/** Creates an empty, mutable argument set */
	public ArgumentSet() {
		thePositionals = new ArrayList<>();
		theOptions = new LinkedHashMap<>();
		theShortToLong = new LinkedHashMap<>();
		theCommands = new LinkedHashMap<>();
		isMutable = true;
	}

	private ArgumentSet(List<PositionalDefinition<?, ?>> positionals, Map<String, OptionDefinition<?, ?>> options,
		Map<Character, String> shortToLong, Map<String, CommandDefinition> commands, CommandSetDefinition<?> commandSet,
		boolean mutable) {
		thePositionals = positionals;
		theOptions = options;
		theShortToLong = shortToLong;
		theCommands = commands;
		theCommandSet = commandSet;
		isMutable = mutable;
	}

	/**
	 * @param parent The set of the scope the command is registered in
	 * @return A mutable set for a command, inheriting the parent's current positionals and options (but not its commands)
	 */
	public static ArgumentSet subCommand(ArgumentSet parent) {
		return new ArgumentSet(new ArrayList<>(parent.thePositionals), new LinkedHashMap<>(parent.theOptions),
			new LinkedHashMap<>(parent.theShortToLong), new LinkedHashMap<>(), null, true);
	}

	/**
	 * @param other The set to freeze
	 * @return An immutable snapshot of the given set
	 */
	public static ArgumentSet unmodifiable(ArgumentSet other) {
		if (!other.isMutable)
			return other;
		return new ArgumentSet(ImmutableList.copyOf(other.thePositionals), ImmutableMap.copyOf(other.theOptions),
			ImmutableMap.copyOf(other.theShortToLong), ImmutableMap.copyOf(other.theCommands), other.theCommandSet, false);
	}

	/** @return Whether arguments may still be registered in this set */
	public boolean isMutable() {
		return isMutable;
	}

	/** @return The positionals, in the order they are filled */
	public List<PositionalDefinition<?, ?>> getPositionals() {
		return isMutable ? Collections.unmodifiableList(thePositionals) : thePositionals;
	}

	/** @return The options by long name, including inverse flag names */
	public Map<String, OptionDefinition<?, ?>> getOptions() {
		return isMutable ? Collections.unmodifiableMap(theOptions) : theOptions;
	}

	/** @return The long name of each option by its short alias */
	public Map<Character, String> getShortToLong() {
		return isMutable ? Collections.unmodifiableMap(theShortToLong) : theShortToLong;
	}

	/** @return The commands by name */
	public Map<String, CommandDefinition> getCommands() {
		return isMutable ? Collections.unmodifiableMap(theCommands) : theCommands;
	}

	/** @return The command set of this scope, or null if this scope has no commands */
	public CommandSetDefinition<?> getCommandSet() {
		return theCommandSet;
	}

	/**
	 * @param name The long name or inverse name of the option
	 * @return The option with the given name, or null if there is none
	 */
	public OptionDefinition<?, ?> getOption(String name) {
		return theOptions.get(name);
	}

	/**
	 * @param shortName The short alias of the option
	 * @return The option with the given alias, or null if there is none
	 */
	public OptionDefinition<?, ?> getOptionByShort(char shortName) {
		String longName = theShortToLong.get(shortName);
		return longName == null ? null : theOptions.get(longName);
	}

	/**
	 * @param includeInverse Whether to include the entries of inverse flag names
	 * @return All commands, then all positionals, then all options, each with the name it is registered under
	 */
	public List<Map.Entry<String, Definition>> allDefinitions(boolean includeInverse) {
		List<Map.Entry<String, Definition>> all = new ArrayList<>(theCommands.size() + thePositionals.size() + theOptions.size());
		for (Map.Entry<String, CommandDefinition> command : theCommands.entrySet())
			all.add(new SimpleImmutableEntry<>(command.getKey(), command.getValue()));
		for (PositionalDefinition<?, ?> positional : thePositionals)
			all.add(new SimpleImmutableEntry<>(positional.getName(), positional));
		for (Map.Entry<String, OptionDefinition<?, ?>> option : theOptions.entrySet()) {
			if (!includeInverse && isInverseKey(option.getKey(), option.getValue()))
				continue;
			all.add(new SimpleImmutableEntry<>(option.getKey(), option.getValue()));
		}
		return Collections.unmodifiableList(all);
	}

	private static boolean isInverseKey(String key, OptionDefinition<?, ?> option) {
		return option.getFlag() != null && key.equals(option.getFlag().getInverse());
	}

	void addPositional(PositionalDefinition<?, ?> positional) {
		checkMutable();
		thePositionals.add(positional);
	}

	void putOption(String name, OptionDefinition<?, ?> option) {
		checkMutable();
		theOptions.put(name, option);
	}

	void putShort(char shortName, String longName) {
		checkMutable();
		theShortToLong.put(shortName, longName);
	}

	void putCommand(String name, CommandDefinition command) {
		checkMutable();
		theCommands.put(name, command);
	}

	void setCommandSet(CommandSetDefinition<?> commandSet) {
		checkMutable();
		theCommandSet = commandSet;
	}

	private void checkMutable() {
		if (!isMutable)
			throw new UnsupportedOperationException("Cannot modify unmodifiable ArgumentSet");
	}

	@Override
	public String toString() {
		return "ArgumentSet(positionals=" + thePositionals + ", options=" + theOptions.keySet() + ", commands=" + theCommands.keySet()
			+ ")";
	}
}
