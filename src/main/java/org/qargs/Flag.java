package org.qargs;

/** Marks an option as a boolean flag and holds its resolved inverse name */
public final class Flag {
	private final String theInverse;

	/** @param inverse The name that sets the flag to false, or null if the flag has no inverse */
	public Flag(String inverse) {
		theInverse = inverse;
	}

	/** @return The name that sets the flag to false, or null if the flag has no inverse */
	public String getInverse() {
		return theInverse;
	}

	@Override
	public String toString() {
		return theInverse == null ? "flag" : "flag(inverse=" + theInverse + ")";
	}
}
