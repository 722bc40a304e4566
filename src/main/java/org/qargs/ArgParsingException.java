package org.qargs;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Thrown when command-line arguments cannot be parsed against the registered arguments. The {@link #getKind() kind} tells what went
 * wrong; the message is suitable for display to the user.
 */
public class ArgParsingException extends Exception {
	private final ArgParsingErrorKind theKind;
	private final String theArgument;
	private final String theName;
	private final String theValue;
	private final String theReason;
	private final List<String> theMissing;

	private ArgParsingException(ArgParsingErrorKind kind, String message, String argument, String name, String value, String reason,
		List<String> missing, Throwable cause) {
		super(message, cause);
		theKind = kind;
		theArgument = argument;
		theName = name;
		theValue = value;
		theReason = reason;
		theMissing = missing == null ? Collections.emptyList() : Collections.unmodifiableList(missing);
	}

	/**
	 * @param argument The option as it was given, e.g. "--foo" or "-x"
	 * @return The exception
	 */
	public static ArgParsingException unknownOption(String argument) {
		return new ArgParsingException(ArgParsingErrorKind.UNKNOWN_OPTION, "Unknown option: " + argument, argument, null, null, null,
			null, null);
	}

	/**
	 * @param name The name of the argument whose value could not be parsed
	 * @param value The text that could not be parsed
	 * @param reason The reason given by the value parser
	 * @param cause The exception thrown by the value parser
	 * @return The exception
	 */
	public static ArgParsingException parsingValue(String name, String value, String reason, Throwable cause) {
		return new ArgParsingException(ArgParsingErrorKind.PARSING_VALUE, "Failed to parse " + name + "[=" + value + "]: " + reason,
			value, name, value, reason, null, cause);
	}

	/**
	 * @param positional The positional text that had no slot
	 * @return The exception
	 */
	public static ArgParsingException tooManyPositionals(String positional) {
		return new ArgParsingException(ArgParsingErrorKind.TOO_MANY_POSITIONALS, "Too many positional arguments: " + positional,
			positional, null, null, null, null, null);
	}

	/** @return The exception */
	public static ArgParsingException missingCommand() {
		return new ArgParsingException(ArgParsingErrorKind.MISSING_COMMAND, "A command is required", null, null, null, null, null, null);
	}

	/**
	 * @param positionals The names of all mandatory positionals that were not given
	 * @return The exception
	 */
	public static ArgParsingException missingPositionals(List<String> positionals) {
		return new ArgParsingException(ArgParsingErrorKind.MISSING_POSITIONALS,
			"Missing required positional argument(s): " + Joiner.on(", ").join(positionals), null, null, null, null, positionals, null);
	}

	/**
	 * @param option The name of the option lacking a value
	 * @return The exception
	 */
	public static ArgParsingException missingOptionValue(String option) {
		return new ArgParsingException(ArgParsingErrorKind.MISSING_OPTION_VALUE, "Option " + option + " requires a value", null, option,
			null, null, null, null);
	}

	/**
	 * @param command The text given where a command was expected
	 * @return The exception
	 */
	public static ArgParsingException unknownCommand(String command) {
		return new ArgParsingException(ArgParsingErrorKind.UNKNOWN_COMMAND, "Unknown command: " + command, command, null, null, null,
			null, null);
	}

	/** @return What went wrong */
	public ArgParsingErrorKind getKind() {
		return theKind;
	}

	/** @return The command-line text that caused the error, if any */
	public String getArgument() {
		return theArgument;
	}

	/** @return The name of the registered argument involved, for {@link ArgParsingErrorKind#PARSING_VALUE} and {@link ArgParsingErrorKind#MISSING_OPTION_VALUE} */
	public String getName() {
		return theName;
	}

	/** @return The text that could not be parsed, for {@link ArgParsingErrorKind#PARSING_VALUE} */
	public String getValue() {
		return theValue;
	}

	/** @return The value parser's reason, for {@link ArgParsingErrorKind#PARSING_VALUE} */
	public String getReason() {
		return theReason;
	}

	/** @return The names of all missing positionals, for {@link ArgParsingErrorKind#MISSING_POSITIONALS} */
	public List<String> getMissingPositionals() {
		return theMissing;
	}
}
