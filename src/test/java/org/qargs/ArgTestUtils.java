package org.qargs;

import org.junit.Assert;

/** Testing utilities for argument parsing */
public class ArgTestUtils {
	/** A parse that is expected to fail */
	@FunctionalInterface
	public interface ParseCall {
		/** @throws ArgParsingException If parsing fails */
		void run() throws ArgParsingException;
	}

	/**
	 * @param kind The kind of error expected
	 * @param call The parse to run
	 * @return The error thrown by the parse
	 */
	public static ArgParsingException assertParseError(ArgParsingErrorKind kind, ParseCall call) {
		try {
			call.run();
		} catch (ArgParsingException e) {
			Assert.assertEquals(e.getMessage(), kind, e.getKind());
			return e;
		}
		Assert.fail("Expected " + kind + ", but parsing succeeded");
		return null;
	}
}
