package org.qargs;

/** The kinds of failure that can occur while parsing command-line arguments */
public enum ArgParsingErrorKind {
	/** An option or flag (long or short) was given that is not registered */
	UNKNOWN_OPTION,
	/** An argument's {@link ValueParser} rejected the argument's text */
	PARSING_VALUE,
	/** More positional arguments were given than were registered */
	TOO_MANY_POSITIONALS,
	/** A command was required but none was given */
	MISSING_COMMAND,
	/** Some mandatory positional arguments were not given */
	MISSING_POSITIONALS,
	/** An option requiring a value was the last argument given */
	MISSING_OPTION_VALUE,
	/** A command was expected but the given text names no registered command */
	UNKNOWN_COMMAND;
}
