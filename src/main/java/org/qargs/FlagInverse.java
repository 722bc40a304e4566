package org.qargs;

import java.util.Objects;

/**
 * Requests how the inverse name of a flag (the name that sets the flag to false) is determined when the flag is registered
 */
public final class FlagInverse {
	/** How the inverse is determined */
	public enum Mode {
		/** The {@link ArgConfig#getInverseGenerator() configured generator} supplies the inverse name, if any */
		AUTO,
		/** The inverse name is given explicitly */
		NAMED,
		/** The flag has no inverse */
		DISABLED
	}

	/** Asks the configured generator for the inverse name */
	public static final FlagInverse AUTO = new FlagInverse(Mode.AUTO, null);
	/** Suppresses the inverse entirely */
	public static final FlagInverse DISABLED = new FlagInverse(Mode.DISABLED, null);

	private final Mode theMode;
	private final String theName;

	private FlagInverse(Mode mode, String name) {
		theMode = mode;
		theName = name;
	}

	/**
	 * @param name The inverse name for the flag
	 * @return A request for the given inverse name
	 * @throws ArgDefinitionException If the name is null or empty
	 */
	public static FlagInverse named(String name) throws ArgDefinitionException {
		if (name == null || name.isEmpty())
			throw new ArgDefinitionException(String.valueOf(name), "Inverse name must not be empty, use DISABLED for no inverse");
		return new FlagInverse(Mode.NAMED, name);
	}

	/** @return How the inverse is determined */
	public Mode getMode() {
		return theMode;
	}

	/** @return The explicit inverse name, for {@link Mode#NAMED} */
	public String getName() {
		return theName;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof FlagInverse))
			return false;
		FlagInverse other = (FlagInverse) obj;
		return theMode == other.theMode && Objects.equals(theName, other.theName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theMode, theName);
	}

	@Override
	public String toString() {
		return theMode == Mode.NAMED ? theName : theMode.name();
	}
}
