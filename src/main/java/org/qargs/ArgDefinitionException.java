package org.qargs;

/**
 * Thrown when arguments are registered inconsistently, e.g. with a duplicate name. This always indicates a bug in the code registering
 * the arguments, never a problem with the command line being parsed.
 */
public class ArgDefinitionException extends IllegalArgumentException {
	private final String theName;

	/**
	 * @param name The offending name
	 * @param message Describes the problem
	 */
	public ArgDefinitionException(String name, String message) {
		super(message + ": \"" + name + "\"");
		theName = name;
	}

	/** @return The name of the argument, short alias, command or group that could not be registered */
	public String getName() {
		return theName;
	}
}
