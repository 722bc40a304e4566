package org.qargs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.qargs.usage.DefaultUsagePrinter;
import org.qargs.usage.UsageContext;
import org.qargs.usage.UsageInfo;
import org.qargs.usage.UsagePrinter;

/** The root argument parser of an application */
public class AppArgParser extends ArgParser {
	private static final Logger log = Logger.getLogger(AppArgParser.class);

	/** Ends the process, or whatever stands in for that in tests */
	@FunctionalInterface
	public interface ExitHandler {
		/** @param status The exit status */
		void exit(int status);
	}

	private ExitHandler theExitHandler;

	/** Creates a parser with the {@link ArgConfig#DEFAULT default config} */
	public AppArgParser() {
		this(ArgConfig.DEFAULT);
	}

	/** @param config The config for parsing */
	public AppArgParser(ArgConfig config) {
		this(UsageInfo.EMPTY, null, config);
	}

	/**
	 * @param info Application-level usage text
	 * @param usagePrinter The usage printer, or null for a {@link DefaultUsagePrinter}
	 * @param config The config for parsing
	 */
	public AppArgParser(UsageInfo info, UsagePrinter usagePrinter, ArgConfig config) {
		super(info, UsageContext.ROOT, usagePrinter == null ? new DefaultUsagePrinter() : usagePrinter, new ArgumentRegistry(config));
		theExitHandler = System::exit;
	}

	/**
	 * @param exitHandler Replaces {@link System#exit(int)} for {@link #parseOrQuit(List, Appendable, boolean)} and the
	 *        {@link #addHelpOption() help option}
	 * @return This parser
	 */
	public AppArgParser setExitHandler(ExitHandler exitHandler) {
		theExitHandler = exitHandler;
		return this;
	}

	/**
	 * @param args The command-line arguments
	 * @throws ArgParsingException If the arguments cannot be parsed
	 */
	public void parse(String... args) throws ArgParsingException {
		parse(Arrays.asList(args));
	}

	/**
	 * @param args The command-line arguments
	 * @throws ArgParsingException If the arguments cannot be parsed
	 */
	public void parse(List<String> args) throws ArgParsingException {
		ParserContext.parse(getConfig(), getArgs(), args);
	}

	/**
	 * Parses the arguments, printing the error and the short usage to {@link System#err} and exiting with status 1 if they cannot be
	 * parsed
	 * 
	 * @param args The command-line arguments
	 */
	public void parseOrQuit(String... args) {
		parseOrQuit(Arrays.asList(args), System.err, true);
	}

	/**
	 * Parses the arguments, printing the error and usage and exiting with status 1 if they cannot be parsed
	 * 
	 * @param args The command-line arguments
	 * @param sink The sink to print the error to
	 * @param showShortUsage Whether to print only the "Usage:" line after the error
	 */
	public void parseOrQuit(List<String> args, Appendable sink, boolean showShortUsage) {
		try {
			parse(args);
		} catch (ArgParsingException e) {
			if (log.isDebugEnabled())
				log.debug("Argument parsing failed (" + e.getKind() + ")", e);
			try {
				sink.append(e.getMessage()).append('\n');
			} catch (IOException ioe) {
				throw new UncheckedIOException(ioe);
			}
			printUsage(sink, showShortUsage);
			theExitHandler.exit(1);
		}
	}

	/**
	 * Adds a "--help"/"-h" flag that prints full usage to {@link System#out} and exits
	 * 
	 * @return The flag's holder
	 */
	public Arg<Boolean> addHelpOption() {
		return addHelpOption("help", "h", "Show this help", null);
	}

	/**
	 * Adds a flag that, when parsed, prints the full usage of the deepest command selected so far and exits with status 0
	 * 
	 * @param name The name of the flag
	 * @param shortName The short alias of the flag, or null
	 * @param description The description of the flag
	 * @param sink The sink to print usage to, or null for {@link System#out}
	 * @return The flag's holder
	 */
	public Arg<Boolean> addHelpOption(String name, String shortName, String description, Appendable sink) {
		return addFlag(name, f -> f.shortName(shortName).description(description).disableInverse().onParse(value -> {
			ArgParser current = this;
			while (true) {
				CommandSetDefinition<?> commandSet = current.getArgs().getCommandSet();
				if (commandSet == null || !commandSet.getValueHolder().isFilled())
					break;
				current = current.getCommandParsers().get(commandSet.printSelected());
			}
			current.printUsage(sink == null ? System.out : sink, false);
			theExitHandler.exit(0);
		}));
	}
}
