package org.qargs;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.qargs.usage.DefaultUsagePrinter;
import org.qargs.usage.TextWrapper;
import org.qargs.usage.UsageInfo;

/** Tests the printing and exiting behavior of {@link AppArgParser} */
public class AppArgParserTest {
	static class ExitCalled extends RuntimeException {
		final int status;

		ExitCalled(int status) {
			super("exit(" + status + ")");
			this.status = status;
		}
	}

	private AppArgParser theParser;
	private StringBuilder theSink;

	/** Creates a parser for an application named "app" that never really exits */
	@Before
	public void setup() {
		theParser = new AppArgParser(new UsageInfo("app", null, null), new DefaultUsagePrinter(0, TextWrapper.DEFAULT), ArgConfig.DEFAULT);
		theParser.setExitHandler(status -> {
			throw new ExitCalled(status);
		});
		theSink = new StringBuilder();
	}

	@Test
	public void testParseOrQuitError() {
		theParser.addPositionalS("file", null);
		List<Integer> exits = new ArrayList<>();
		theParser.setExitHandler(exits::add);
		theParser.parseOrQuit(Arrays.asList("--nope"), theSink, true);

		Assert.assertEquals(Collections.singletonList(1), exits);
		Assert.assertEquals("Unknown option: --nope\nUsage: app <file>\n", theSink.toString());
	}

	@Test
	public void testParseOrQuitSuccess() {
		Arg<String> file = theParser.addPositionalS("file", null);
		theParser.parseOrQuit(Arrays.asList("f.txt"), theSink, true);

		Assert.assertEquals("f.txt", file.get());
		Assert.assertEquals("", theSink.toString());
	}

	@Test
	public void testHelp() {
		theParser.addHelpOption("help", "h", "Show this help", theSink);
		theParser.addPositionalS("file", p -> p.description("The file"));
		try {
			theParser.parseOrQuit(Arrays.asList("-h"), theSink, true);
			Assert.fail("Expected help to exit");
		} catch (ExitCalled e) {
			Assert.assertEquals(0, e.status);
		}
		String usage = theSink.toString();
		assertThat(usage, startsWith("Usage: app <file> [-h|--help[=true|false]]\n"));
		assertThat(usage, containsString("  file  The file\n"));
	}

	/** Help prints the usage of the deepest command selected before it */
	@Test
	public void testCommandHelp() {
		theParser.addHelpOption("help", "h", "Show this help", theSink);
		CommandSet<String> commands = theParser.addCommandsS();
		CommandParser build = commands.addCommand("build", "Builds it", null);
		build.addFlag("release", f -> f.description("Optimize"));
		commands.addCommand("clean");
		try {
			theParser.parse("build", "--help");
			Assert.fail("Expected help to exit");
		} catch (ExitCalled e) {
			Assert.assertEquals(0, e.status);
		} catch (ArgParsingException e) {
			throw new AssertionError(e);
		}
		assertThat(theSink.toString(), startsWith("Usage: app build [-h|--help[=true|false]] [--release[=true|false]]\n"));
		assertThat(theSink.toString(), containsString("--release[=true|false]"));
	}

	@Test
	public void testRootHelpListsCommands() {
		theParser.addHelpOption("help", "h", "Show this help", theSink);
		CommandSet<String> commands = theParser.addCommandsS();
		commands.addCommand("build", "Builds it", null);
		commands.addCommand("clean");
		try {
			theParser.parse("--help");
			Assert.fail("Expected help to exit");
		} catch (ExitCalled e) {
			Assert.assertEquals(0, e.status);
		} catch (ArgParsingException e) {
			throw new AssertionError(e);
		}
		String usage = theSink.toString();
		assertThat(usage, startsWith("Usage: app <command> [-h|--help[=true|false]]\n"));
		assertThat(usage, containsString("\nCommands:\n\n  build  Builds it\n  clean\n"));
	}

	@Test
	public void testPrintUsageString() {
		theParser.addPositionalS("file", null);
		Assert.assertEquals("Usage: app <file>\n", theParser.printUsage(true));
	}
}
