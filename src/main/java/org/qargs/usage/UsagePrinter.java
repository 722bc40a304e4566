package org.qargs.usage;

import java.io.IOException;

import org.qargs.ArgumentSet;

/** Renders usage text for one scope's arguments */
@FunctionalInterface
public interface UsagePrinter {
	/**
	 * @param args The arguments of the scope
	 * @param info Application-level text
	 * @param context The commands leading to the scope
	 * @param sink The sink to print to
	 * @param shortUsage Whether to print only the "Usage:" line
	 * @throws IOException If the sink throws it
	 */
	void print(ArgumentSet args, UsageInfo info, UsageContext context, Appendable sink, boolean shortUsage) throws IOException;
}
