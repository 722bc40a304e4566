package org.qargs;

/** Synthesizes the inverse name of a flag from the flag's name */
@FunctionalInterface
public interface InverseGenerator {
	/** Never generates an inverse */
	InverseGenerator NONE = name -> null;

	/**
	 * @param flagName The name of the flag
	 * @return The name of the flag's inverse, or null if the flag should have no inverse
	 */
	String generate(String flagName);

	/**
	 * @param prefix The prefix to prepend
	 * @return A generator that prepends the given prefix to every flag name, e.g. "no-"
	 * @throws ArgDefinitionException If the prefix is null or empty
	 */
	static InverseGenerator prefixed(String prefix) throws ArgDefinitionException {
		if (prefix == null || prefix.isEmpty())
			throw new ArgDefinitionException(String.valueOf(prefix), "Inverse prefix must not be empty");
		return name -> prefix + name;
	}
}
