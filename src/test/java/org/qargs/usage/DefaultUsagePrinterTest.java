package org.qargs.usage;

import org.junit.Assert;
import org.junit.Test;
import org.qargs.AppArgParser;
import org.qargs.ArgConfig;
import org.qargs.PrefixInverseGenerator;
import org.qargs.ValueParsers;

/** Tests the output of {@link DefaultUsagePrinter} */
public class DefaultUsagePrinterTest {
	private static AppArgParser createParser(UsageInfo info, DefaultUsagePrinter printer) {
		AppArgParser parser = new AppArgParser(info, printer, ArgConfig.DEFAULT.withInverseGenerator(new PrefixInverseGenerator()));
		parser.addPositionalS("input", p -> p.description("The input file"));
		parser.addOptionSN("output", o -> o.shortName("o").valueDescription("FILE").description("The output file"));
		parser.addFlag("with-x", f -> f.description("Colorize"));
		UsageGroup advanced = parser.createUsageGroup("Advanced");
		parser.addOption("level", 1, ValueParsers.INT, o -> o.usageGroup(advanced).description("Tuning level"));
		return parser;
	}

	@Test
	public void testShortUsage() {
		AppArgParser parser = createParser(new UsageInfo("app", "Does things.", "Bye."), new DefaultUsagePrinter(0, TextWrapper.DEFAULT));
		Assert.assertEquals("Usage: app <input> [-o|--output=FILE] [--with{-x,out-x}[=true|false]] [--level=VALUE]\n",
			parser.printUsage(true));
	}

	@Test
	public void testFullUsage() {
		AppArgParser parser = createParser(new UsageInfo("app", "Does things.", "Bye."), new DefaultUsagePrinter(0, TextWrapper.DEFAULT));
		String expected = "Usage: app <input> [-o|--output=FILE] [--with{-x,out-x}[=true|false]] [--level=VALUE]\n"//
			+ "\n"//
			+ "Does things.\n"//
			+ "\n"//
			+ "Positional arguments:\n"//
			+ "\n"//
			+ "  input  The input file\n"//
			+ "\n"//
			+ "Options:\n"//
			+ "\n"//
			+ "  -o, --output=FILE              The output file\n"//
			+ "  --with{-x,out-x}[=true|false]  Colorize\n"//
			+ "\n"//
			+ "Advanced:\n"//
			+ "\n"//
			+ "  --level=VALUE  Tuning level\n"//
			+ "\n"//
			+ "Bye.\n"//
			+ "\n";
		Assert.assertEquals(expected, parser.printUsage(false));
	}

	/** Descriptions wrap within their column */
	@Test
	public void testWrappedDescription() {
		AppArgParser parser = new AppArgParser(UsageInfo.EMPTY, new DefaultUsagePrinter(40, TextWrapper.DEFAULT), ArgConfig.DEFAULT);
		parser.addOptionSN("name", o -> o.description("one two three four five six seven eight nine ten"));
		String expected = "Usage: <this application> [--name=VALUE]\n"//
			+ "\n"//
			+ "Options:\n"//
			+ "\n"//
			+ "  --name=VALUE  one two three four\n"//
			+ "                five six seven eight\n"//
			+ "                nine ten\n"//
			+ "\n";
		Assert.assertEquals(expected, parser.printUsage(false));
	}

	/** The "Usage:" prefix counts toward the width of the first line */
	@Test
	public void testWrappedUsageLine() {
		AppArgParser parser = new AppArgParser(new UsageInfo("app", null, null), new DefaultUsagePrinter(30, TextWrapper.DEFAULT),
			ArgConfig.DEFAULT);
		parser.addOptionSN("alpha", null);
		parser.addOptionSN("beta", null);
		String usage = parser.printUsage(true);
		Assert.assertEquals("Usage: app [--alpha=VALUE]\n[--beta=VALUE]\n", usage);
		for (String line : usage.split("\n"))
			Assert.assertTrue(line, line.length() <= 30);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeWidth() {
		new DefaultUsagePrinter(-1, TextWrapper.DEFAULT);
	}
}
