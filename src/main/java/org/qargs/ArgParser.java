package org.qargs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import org.qargs.usage.UsageContext;
import org.qargs.usage.UsageGroup;
import org.qargs.usage.UsageInfo;
import org.qargs.usage.UsagePrinter;

/**
 * <p>
 * Registers the arguments of one scope: the application itself ({@link AppArgParser}) or one of its commands
 * ({@link CommandParser}). Each <code>add*</code> method returns the {@link Arg} holder that receives the argument's value when the
 * application's arguments are parsed.
 * </p>
 * <p>
 * Methods ending in <code>S</code> parse strings. Methods ending in <code>N</code> default to null. Methods ending in <code>SN</code>
 * do both. Details of each argument are given by an optional <code>configure</code> callback, which may be null.
 * </p>
 */
public abstract class ArgParser {
	private final UsageInfo theInfo;
	private final UsageContext theUsageContext;
	private final UsagePrinter theUsagePrinter;
	private final ArgumentRegistry theRegistry;
	private final Map<String, CommandParser> theCommandParsers;

	ArgParser(UsageInfo info, UsageContext usageContext, UsagePrinter usagePrinter, ArgumentRegistry registry) {
		theInfo = info;
		theUsageContext = usageContext;
		theUsagePrinter = usagePrinter;
		theRegistry = registry;
		theCommandParsers = new LinkedHashMap<>();
	}

	/** @return The config for parsing this parser's arguments */
	public ArgConfig getConfig() {
		return theRegistry.getConfig();
	}

	/** @return A frozen snapshot of the arguments registered so far */
	public ArgumentSet getArgs() {
		return theRegistry.getArgs();
	}

	/** @return The parser of each command registered here, by command name */
	public Map<String, CommandParser> getCommandParsers() {
		return Collections.unmodifiableMap(theCommandParsers);
	}

	/** @return The usage groups created in this parser */
	public Set<UsageGroup> getUsageGroups() {
		return theRegistry.getUsageGroups();
	}

	/** @return Application-level usage text */
	public UsageInfo getInfo() {
		return theInfo;
	}

	/** @return The chain of commands leading to this parser */
	public UsageContext getUsageContext() {
		return theUsageContext;
	}

	/** @return The printer for this parser's usage */
	public UsagePrinter getUsagePrinter() {
		return theUsagePrinter;
	}

	/**
	 * @param name The name of the group
	 * @return A new usage group
	 * @throws ArgDefinitionException If a group with the same name was already created in this parser
	 */
	public UsageGroup createUsageGroup(String name) throws ArgDefinitionException {
		return theRegistry.createUsageGroup(name);
	}

	/**
	 * Adds a mandatory (unless configured otherwise) string positional
	 * 
	 * @param name The name of the positional
	 * @param configure Configures the positional, or null
	 * @return The positional's holder
	 */
	public Arg<String> addPositionalS(String name, Consumer<PositionalBuilder<String, String>> configure) {
		return addPositional(name, ValueParsers.IDENTITY, configure);
	}

	/**
	 * Adds an optional string positional that defaults to null
	 * 
	 * @param name The name of the positional
	 * @param configure Configures the positional, or null
	 * @return The positional's holder
	 */
	public Arg<String> addPositionalSN(String name, Consumer<PositionalBuilder<String, String>> configure) {
		return addPositionalN(name, ValueParsers.IDENTITY, configure);
	}

	/**
	 * Adds an optional positional that defaults to null
	 * 
	 * @param <T> The type of the positional
	 * @param name The name of the positional
	 * @param parser The parser for the positional
	 * @param configure Configures the positional, or null
	 * @return The positional's holder
	 */
	public <T> Arg<T> addPositionalN(String name, ValueParser<T> parser, Consumer<PositionalBuilder<T, T>> configure) {
		return addPositional(name, parser, Accumulator.discard(), false, Requirement.optional(null), configure);
	}

	/**
	 * Adds a single-valued positional, mandatory unless configured otherwise
	 * 
	 * @param <T> The type of the positional
	 * @param name The name of the positional
	 * @param parser The parser for the positional
	 * @param configure Configures the positional, or null
	 * @return The positional's holder
	 */
	public <T> Arg<T> addPositional(String name, ValueParser<T> parser, Consumer<PositionalBuilder<T, T>> configure) {
		return addPositional(name, parser, Accumulator.discard(), false, null, configure);
	}

	/**
	 * Adds a string positional that receives all remaining positional text. It must be the last positional.
	 * 
	 * @param <U> The type of the accumulated value
	 * @param name The name of the positional
	 * @param accumulator The accumulator for the values
	 * @param configure Configures the positional, or null
	 * @return The positional's holder
	 */
	public <U> Arg<U> addMultiPositionalS(String name, Accumulator<String, U> accumulator,
		Consumer<PositionalBuilder<String, U>> configure) {
		return addMultiPositional(name, ValueParsers.IDENTITY, accumulator, configure);
	}

	/**
	 * Adds a positional that receives all remaining positional text. It must be the last positional.
	 * 
	 * @param <T> The type of each value
	 * @param <U> The type of the accumulated value
	 * @param name The name of the positional
	 * @param parser The parser for each value
	 * @param accumulator The accumulator for the values
	 * @param configure Configures the positional, or null
	 * @return The positional's holder
	 */
	public <T, U> Arg<U> addMultiPositional(String name, ValueParser<T> parser, Accumulator<T, U> accumulator,
		Consumer<PositionalBuilder<T, U>> configure) {
		return addPositional(name, parser, accumulator, true, null, configure);
	}

	private <T, U> Arg<U> addPositional(String name, ValueParser<T> parser, Accumulator<T, U> accumulator, boolean multi,
		Requirement<U> requirement, Consumer<PositionalBuilder<T, U>> configure) {
		PositionalBuilder<T, U> builder = new PositionalBuilder<>(requirement);
		if (configure != null)
			configure.accept(builder);
		return theRegistry.addPositional(name, builder.theDescription, builder.theUsageGroup, builder.theRequirement, parser,
			builder.thePrinter, accumulator, multi, builder.theNoOptionsFollowing);
	}

	/**
	 * @param name The name of the option
	 * @param defaultValue The value if the option is not given
	 * @param configure Configures the option, or null
	 * @return The option's holder
	 */
	public Arg<String> addOptionS(String name, String defaultValue, Consumer<OptionBuilder<String>> configure) {
		return addOption(name, defaultValue, ValueParsers.IDENTITY, configure);
	}

	/**
	 * @param name The name of the option
	 * @param configure Configures the option, or null
	 * @return The option's holder, defaulting to null
	 */
	public Arg<String> addOptionSN(String name, Consumer<OptionBuilder<String>> configure) {
		return addOption(name, null, ValueParsers.IDENTITY, configure);
	}

	/**
	 * @param <T> The type of the option
	 * @param name The name of the option
	 * @param parser The parser for the option's value
	 * @param configure Configures the option, or null
	 * @return The option's holder, defaulting to null
	 */
	public <T> Arg<T> addOptionN(String name, ValueParser<T> parser, Consumer<OptionBuilder<T>> configure) {
		return addOption(name, null, parser, configure);
	}

	/**
	 * Adds an option whose last given value wins
	 * 
	 * @param <T> The type of the option
	 * @param name The name of the option
	 * @param defaultValue The value if the option is not given
	 * @param parser The parser for the option's value
	 * @param configure Configures the option, or null
	 * @return The option's holder
	 */
	public <T> Arg<T> addOption(String name, T defaultValue, ValueParser<T> parser, Consumer<OptionBuilder<T>> configure) {
		return addMultiOption(name, defaultValue, parser, Accumulator.discard(), configure);
	}

	/**
	 * @param <U> The type of the accumulated value
	 * @param name The name of the option
	 * @param defaultValue The value if the option is not given
	 * @param accumulator The accumulator for the option's values
	 * @param configure Configures the option, or null
	 * @return The option's holder
	 */
	public <U> Arg<U> addMultiOptionS(String name, U defaultValue, Accumulator<String, U> accumulator,
		Consumer<OptionBuilder<String>> configure) {
		return addMultiOption(name, defaultValue, ValueParsers.IDENTITY, accumulator, configure);
	}

	/**
	 * @param <U> The type of the accumulated value
	 * @param name The name of the option
	 * @param accumulator The accumulator for the option's values
	 * @param configure Configures the option, or null
	 * @return The option's holder, defaulting to null
	 */
	public <U> Arg<U> addMultiOptionSN(String name, Accumulator<String, U> accumulator, Consumer<OptionBuilder<String>> configure) {
		return addMultiOption(name, null, ValueParsers.IDENTITY, accumulator, configure);
	}

	/**
	 * @param <T> The type of each value
	 * @param <U> The type of the accumulated value
	 * @param name The name of the option
	 * @param parser The parser for each value
	 * @param accumulator The accumulator for the option's values
	 * @param configure Configures the option, or null
	 * @return The option's holder, defaulting to null
	 */
	public <T, U> Arg<U> addMultiOptionN(String name, ValueParser<T> parser, Accumulator<T, U> accumulator,
		Consumer<OptionBuilder<T>> configure) {
		return addMultiOption(name, null, parser, accumulator, configure);
	}

	/**
	 * Adds an option that may be given multiple times
	 * 
	 * @param <T> The type of each value
	 * @param <U> The type of the accumulated value
	 * @param name The name of the option
	 * @param defaultValue The value if the option is not given
	 * @param parser The parser for each value
	 * @param accumulator The accumulator for the option's values
	 * @param configure Configures the option, or null
	 * @return The option's holder
	 */
	public <T, U> Arg<U> addMultiOption(String name, U defaultValue, ValueParser<T> parser, Accumulator<T, U> accumulator,
		Consumer<OptionBuilder<T>> configure) {
		OptionBuilder<T> builder = new OptionBuilder<>();
		if (configure != null)
			configure.accept(builder);
		return theRegistry.addOption(name, builder.theDescription, builder.theValueDescription, builder.theUsageGroup,
			builder.theShortName, null, defaultValue, parser, builder.thePrinter, accumulator);
	}

	/**
	 * Adds a boolean flag defaulting to false
	 * 
	 * @param name The name of the flag
	 * @param configure Configures the flag, or null
	 * @return The flag's holder
	 */
	public Arg<Boolean> addFlag(String name, Consumer<FlagBuilder> configure) {
		return addFlag(name, false, configure);
	}

	/**
	 * Adds a boolean flag
	 * 
	 * @param name The name of the flag
	 * @param defaultValue The value if the flag is not given
	 * @param configure Configures the flag, or null
	 * @return The flag's holder
	 */
	public Arg<Boolean> addFlag(String name, boolean defaultValue, Consumer<FlagBuilder> configure) {
		return addMultiFlag(name, defaultValue, Accumulator.discard(), configure);
	}

	/**
	 * Adds a boolean flag that may be given multiple times, e.g. with {@link Accumulator#flagCount()} for a verbosity level
	 * 
	 * @param <U> The type of the accumulated value
	 * @param name The name of the flag
	 * @param defaultValue The value if the flag is not given
	 * @param accumulator The accumulator for the flag's values
	 * @param configure Configures the flag, or null
	 * @return The flag's holder
	 */
	public <U> Arg<U> addMultiFlag(String name, U defaultValue, Accumulator<Boolean, U> accumulator, Consumer<FlagBuilder> configure) {
		FlagBuilder builder = new FlagBuilder();
		if (configure != null)
			configure.accept(builder);
		ValueParser<Boolean> parser = ValueParsers.BOOLEAN;
		if (builder.theOnParse != null) {
			Consumer<Boolean> onParse = builder.theOnParse;
			parser = parser.also(onParse::accept);
		}
		return theRegistry.addOption(name, builder.theDescription, null, builder.theUsageGroup, builder.theShortName, builder.theInverse,
			defaultValue, parser, null, accumulator);
	}

	/** @return A command set whose commands are identified by their names */
	public CommandSet<String> addCommandsS() {
		return addCommands(ValueParsers.IDENTITY, ValuePrinter.toStringPrinter());
	}

	/**
	 * Requires exactly one command to be given to this parser
	 * 
	 * @param <T> The type of the command identifiers
	 * @param parser The parser for command identifiers
	 * @param printer The printer producing each command's name from its identifier, or null to use
	 *        {@link ValuePrinter#toStringPrinter()}
	 * @return The command set to add commands to
	 * @throws ArgDefinitionException If this parser already has a command set
	 */
	public <T> CommandSet<T> addCommands(ValueParser<T> parser, ValuePrinter<T> printer) throws ArgDefinitionException {
		return new CommandSet<>(this, theRegistry.addCommands(parser, printer == null ? ValuePrinter.toStringPrinter() : printer));
	}

	void registerCommandParser(String name, CommandParser parser) {
		theCommandParsers.put(name, parser);
	}

	/**
	 * @param sink The sink to print to
	 * @param shortUsage Whether to print only the "Usage:" line
	 * @throws UncheckedIOException If the sink throws an {@link IOException}
	 */
	public void printUsage(Appendable sink, boolean shortUsage) throws UncheckedIOException {
		try {
			theUsagePrinter.print(getArgs(), theInfo, theUsageContext, sink, shortUsage);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * @param shortUsage Whether to print only the "Usage:" line
	 * @return The usage text for this parser
	 */
	public String printUsage(boolean shortUsage) {
		StringBuilder str = new StringBuilder();
		printUsage(str, shortUsage);
		return str.toString();
	}

	/**
	 * Configures a positional argument
	 * 
	 * @param <T> The type of each value
	 * @param <U> The type of the accumulated value
	 */
	public static class PositionalBuilder<T, U> {
		String theDescription;
		UsageGroup theUsageGroup;
		Requirement<U> theRequirement;
		ValuePrinter<T> thePrinter;
		Boolean theNoOptionsFollowing;

		PositionalBuilder(Requirement<U> requirement) {
			theRequirement = requirement;
		}

		/**
		 * @param description The description for usage text
		 * @return This builder
		 */
		public PositionalBuilder<T, U> description(String description) {
			theDescription = description;
			return this;
		}

		/**
		 * @param usageGroup The group to list the positional under in usage text
		 * @return This builder
		 */
		public PositionalBuilder<T, U> usageGroup(UsageGroup usageGroup) {
			theUsageGroup = usageGroup;
			return this;
		}

		/** @return This builder, making the positional mandatory */
		public PositionalBuilder<T, U> required() {
			theRequirement = Requirement.mandatory();
			return this;
		}

		/**
		 * @param defaultValue The value if the positional is not given
		 * @return This builder, making the positional optional
		 */
		public PositionalBuilder<T, U> optional(U defaultValue) {
			theRequirement = Requirement.optional(defaultValue);
			return this;
		}

		/**
		 * @param printer The printer for the positional's values
		 * @return This builder
		 */
		public PositionalBuilder<T, U> printer(ValuePrinter<T> printer) {
			thePrinter = printer;
			return this;
		}

		/**
		 * @param noOptionsFollowing Whether all tokens after this positional are positional text, even if they look like options
		 * @return This builder
		 */
		public PositionalBuilder<T, U> noOptionsFollowing(boolean noOptionsFollowing) {
			theNoOptionsFollowing = noOptionsFollowing;
			return this;
		}
	}

	/**
	 * Configures an option
	 * 
	 * @param <T> The type of each value
	 */
	public static class OptionBuilder<T> {
		String theDescription;
		String theValueDescription;
		UsageGroup theUsageGroup;
		String theShortName;
		ValuePrinter<T> thePrinter;

		OptionBuilder() {}

		/**
		 * @param description The description for usage text
		 * @return This builder
		 */
		public OptionBuilder<T> description(String description) {
			theDescription = description;
			return this;
		}

		/**
		 * @param valueDescription The description of the value for usage text, e.g. "FILE"
		 * @return This builder
		 */
		public OptionBuilder<T> valueDescription(String valueDescription) {
			theValueDescription = valueDescription;
			return this;
		}

		/**
		 * @param usageGroup The group to list the option under in usage text
		 * @return This builder
		 */
		public OptionBuilder<T> usageGroup(UsageGroup usageGroup) {
			theUsageGroup = usageGroup;
			return this;
		}

		/**
		 * @param shortName The single-character alias of the option
		 * @return This builder
		 */
		public OptionBuilder<T> shortName(String shortName) {
			theShortName = shortName;
			return this;
		}

		/**
		 * @param printer The printer for the option's values
		 * @return This builder
		 */
		public OptionBuilder<T> printer(ValuePrinter<T> printer) {
			thePrinter = printer;
			return this;
		}
	}

	/** Configures a flag */
	public static class FlagBuilder {
		String theDescription;
		UsageGroup theUsageGroup;
		String theShortName;
		FlagInverse theInverse = FlagInverse.AUTO;
		Consumer<Boolean> theOnParse;

		FlagBuilder() {}

		/**
		 * @param description The description for usage text
		 * @return This builder
		 */
		public FlagBuilder description(String description) {
			theDescription = description;
			return this;
		}

		/**
		 * @param usageGroup The group to list the flag under in usage text
		 * @return This builder
		 */
		public FlagBuilder usageGroup(UsageGroup usageGroup) {
			theUsageGroup = usageGroup;
			return this;
		}

		/**
		 * @param shortName The single-character alias of the flag
		 * @return This builder
		 */
		public FlagBuilder shortName(String shortName) {
			theShortName = shortName;
			return this;
		}

		/**
		 * @param inverse The name that sets the flag to false. If not set, the {@link ArgConfig#getInverseGenerator() configured
		 *        generator} supplies it.
		 * @return This builder
		 */
		public FlagBuilder inverse(String inverse) {
			theInverse = FlagInverse.named(inverse);
			return this;
		}

		/** @return This builder, giving the flag no inverse even if the config would generate one */
		public FlagBuilder disableInverse() {
			theInverse = FlagInverse.DISABLED;
			return this;
		}

		/**
		 * @param onParse Called with each value parsed for the flag, as it is parsed
		 * @return This builder
		 */
		public FlagBuilder onParse(Consumer<Boolean> onParse) {
			theOnParse = onParse;
			return this;
		}
	}
}
