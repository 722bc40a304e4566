package org.qargs.usage;

/** Application-level text printed in usage output */
public final class UsageInfo {
	/** No application name, prologue or epilogue */
	public static final UsageInfo EMPTY = new UsageInfo(null, null, null);

	private final String theApplication;
	private final String thePrologue;
	private final String theEpilogue;

	/**
	 * @param application The name of the application, or null
	 * @param prologue Text printed before the argument lists in full usage, or null
	 * @param epilogue Text printed after the argument lists in full usage, or null
	 */
	public UsageInfo(String application, String prologue, String epilogue) {
		theApplication = application;
		thePrologue = prologue;
		theEpilogue = epilogue;
	}

	/** @return The name of the application, or null */
	public String getApplication() {
		return theApplication;
	}

	/** @return Text printed before the argument lists in full usage, or null */
	public String getPrologue() {
		return thePrologue;
	}

	/** @return Text printed after the argument lists in full usage, or null */
	public String getEpilogue() {
		return theEpilogue;
	}
}
