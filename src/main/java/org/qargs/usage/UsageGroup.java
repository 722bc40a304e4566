package org.qargs.usage;

import org.qargs.Named;

/** A heading that arguments can be listed under in usage text. Groups are equal if their names are. */
public final class UsageGroup implements Named {
	private final String theName;

	/**
	 * Groups are normally created with {@link org.qargs.ArgParser#createUsageGroup(String)}, which checks for duplicates
	 * 
	 * @param name The name of the group
	 */
	public UsageGroup(String name) {
		if (name == null)
			throw new NullPointerException("Usage group name must not be null");
		theName = name;
	}

	@Override
	public String getName() {
		return theName;
	}

	@Override
	public int hashCode() {
		return theName.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof UsageGroup && theName.equals(((UsageGroup) obj).theName);
	}

	@Override
	public String toString() {
		return "UsageGroup(" + theName + ")";
	}
}
